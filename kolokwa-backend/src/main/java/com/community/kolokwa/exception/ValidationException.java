package com.community.kolokwa.exception;

import org.springframework.http.HttpStatus;

/** Malformed input: unknown vote polarity, unknown classification, blank text. */
public class ValidationException extends KolokwaException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
