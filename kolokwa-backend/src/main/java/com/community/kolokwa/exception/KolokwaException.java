package com.community.kolokwa.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class of the domain errors reported to callers. Each subclass fixes the HTTP status
 * the global exception handler answers with; no state is mutated when one is thrown before
 * the transaction commits.
 */
public abstract class KolokwaException extends RuntimeException {

    private final HttpStatus status;

    protected KolokwaException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected KolokwaException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
