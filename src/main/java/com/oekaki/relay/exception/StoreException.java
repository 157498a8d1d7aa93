package com.oekaki.relay.exception;

import org.springframework.http.HttpStatus;

/** Metadata or blob store read/write failure. */
public class StoreException extends OekakiException {

    public StoreException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, message);
    }

    public StoreException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, message, cause);
    }
}
