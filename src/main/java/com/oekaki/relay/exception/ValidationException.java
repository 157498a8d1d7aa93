package com.oekaki.relay.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends OekakiException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, BAD_REQUEST, message);
    }
}
