package com.oekaki.relay.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for every failure the API reports. Carries the HTTP status and the short
 * reason that is safe to show to clients; the message stays in the logs.
 */
@Getter
public abstract class OekakiException extends RuntimeException {

    public static final String BAD_REQUEST = "bad request";
    public static final String INTERNAL_ERROR = "internal server error";

    private final HttpStatus status;
    private final String reason;

    protected OekakiException(HttpStatus status, String reason, String message) {
        super(message);
        this.status = status;
        this.reason = reason;
    }

    protected OekakiException(HttpStatus status, String reason, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.reason = reason;
    }
}
