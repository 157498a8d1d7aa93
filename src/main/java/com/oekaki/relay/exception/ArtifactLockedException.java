package com.oekaki.relay.exception;

import org.springframework.http.HttpStatus;

/** The drawing already holds the maximum number of revisions. */
public class ArtifactLockedException extends OekakiException {

    public ArtifactLockedException(String artifactId) {
        super(HttpStatus.LOCKED, "this image is already completed", "Artifact " + artifactId + " is complete");
    }
}
