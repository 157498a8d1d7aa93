package com.oekaki.relay.exception;

import org.springframework.http.HttpStatus;

/**
 * Unknown drawing id. A revision aimed at a missing drawing is a bad request (400);
 * a read of a missing drawing is a plain 404.
 */
public class ArtifactNotFoundException extends OekakiException {

    private ArtifactNotFoundException(HttpStatus status, String reason, String artifactId) {
        super(status, reason, "No artifact with id " + artifactId);
    }

    public static ArtifactNotFoundException forRevision(String artifactId) {
        return new ArtifactNotFoundException(HttpStatus.BAD_REQUEST, "invalid image id", artifactId);
    }

    public static ArtifactNotFoundException forRead(String artifactId) {
        return new ArtifactNotFoundException(HttpStatus.NOT_FOUND, "no such image_id", artifactId);
    }
}
