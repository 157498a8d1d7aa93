package com.oekaki.relay.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A drawing plus its stored rendering. {@code type} is {@code bin} when the blob
 * exists and {@code jpg} with an empty payload when it does not, so the client
 * falls back to the preview image.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactDetail {

    public static final String TYPE_BIN = "bin";
    public static final String TYPE_FALLBACK = "jpg";

    @JsonUnwrapped
    private ArtifactSummary artifact;
    private List<Integer> payload;
    private String type;
}
