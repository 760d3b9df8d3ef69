package com.community.kolokwa.exception;

import org.springframework.http.HttpStatus;

/**
 * The reward pipeline (points, badges, streaks) failed unexpectedly. The surrounding
 * transaction is rolled back as a whole.
 */
public class DependencyException extends KolokwaException {

    public DependencyException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
