package com.community.kolokwa.exception;

import org.springframework.http.HttpStatus;

/** Self-verification, or editing / withdrawing / moderating without the right. */
public class ForbiddenException extends KolokwaException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
