package com.oekaki.relay.service;

import com.oekaki.relay.dto.SubmissionRequest;
import com.oekaki.relay.dto.ValidatedSubmission;
import com.oekaki.relay.dto.ValidationOutcome;
import com.oekaki.relay.util.PayloadFrame;
import org.springframework.stereotype.Component;

/**
 * Structural and size checks on an incoming submission. Pure: touches no store
 * and reports a rejection instead of throwing.
 */
@Component
public class SubmissionValidator {

    public static final int MAX_TEXT_LENGTH = 20;
    public static final String DEFAULT_AUTHOR = "名無し";

    public ValidationOutcome validate(SubmissionRequest req) {
        if (req == null) {
            return ValidationOutcome.rejected("empty body");
        }
        if (req.getImageData() == null || req.getImageData().isEmpty()) {
            return ValidationOutcome.rejected("missing image data");
        }
        if (!PayloadFrame.hasMagic(req.getPayload())) {
            return ValidationOutcome.rejected("payload missing or not tagged");
        }
        if (!PayloadFrame.allBytes(req.getPayload())) {
            return ValidationOutcome.rejected("payload contains values outside 0..255");
        }
        if (req.getDescription() != null && req.getDescription().length() > MAX_TEXT_LENGTH) {
            return ValidationOutcome.rejected("description longer than " + MAX_TEXT_LENGTH);
        }

        String author = req.getAuthor() == null ? DEFAULT_AUTHOR : req.getAuthor();
        if (author.length() > MAX_TEXT_LENGTH) {
            return ValidationOutcome.rejected("author longer than " + MAX_TEXT_LENGTH);
        }

        return ValidationOutcome.accepted(new ValidatedSubmission(
                author,
                req.getDescription(),
                req.getImageData(),
                PayloadFrame.unframe(req.getPayload())));
    }
}
