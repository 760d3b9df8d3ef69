package com.community.kolokwa.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends KolokwaException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
