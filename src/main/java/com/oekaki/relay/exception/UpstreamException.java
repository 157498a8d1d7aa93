package com.oekaki.relay.exception;

import org.springframework.http.HttpStatus;

/** Preview host refused the call, failed, or timed out. */
public class UpstreamException extends OekakiException {

    public UpstreamException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, message, cause);
    }
}
