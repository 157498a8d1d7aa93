package com.oekaki.relay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw submission body as posted by the drawing client. Nothing here is trusted
 * until it has passed {@code SubmissionValidator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionRequest {

    /** Drawing to revise; absent for a new drawing. */
    private String id;

    /** Framed binary rendering: 4-byte tag followed by the image-bin bytes. */
    private List<Integer> payload;

    private String description;

    private String author;

    /** Base64 image for the preview host, optionally with a data-URI prefix. */
    @JsonProperty("_bs")
    private String imageData;
}
