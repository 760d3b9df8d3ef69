package com.community.kolokwa.exception;

import org.springframework.http.HttpStatus;

/** Duplicate submissions and requests that clash with the current state of an entry or challenge. */
public class ConflictException extends KolokwaException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
