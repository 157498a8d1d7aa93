package com.oekaki.relay.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Either a {@link ValidatedSubmission} or the reason it was rejected. */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationOutcome {

    private final ValidatedSubmission submission;
    private final String rejection;

    public static ValidationOutcome accepted(ValidatedSubmission submission) {
        return new ValidationOutcome(submission, null);
    }

    public static ValidationOutcome rejected(String rejection) {
        return new ValidationOutcome(null, rejection);
    }

    public boolean isValid() {
        return submission != null;
    }
}
