package com.oekaki.relay.dto;

import lombok.Value;

/** Submission that passed validation: author resolved, payload unframed. */
@Value
public class ValidatedSubmission {
    String author;
    String description;
    String imageData;
    byte[] body;
}
