package com.oekaki.relay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.oekaki.relay.model.Artifact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Client view of a drawing. The preview delete token never leaves the service. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactSummary {
    private String id;
    private String author;
    @JsonProperty("ip")
    private String submitterAddress;
    private String description;
    @JsonProperty("imgurId")
    private String previewAssetId;
    @JsonProperty("count")
    private int revisionCount;
    @JsonProperty("created_at")
    private long createdAt;

    public static ArtifactSummary from(Artifact a) {
        return ArtifactSummary.builder()
                .id(a.getId())
                .author(a.getAuthor())
                .submitterAddress(a.getSubmitterAddress())
                .description(a.getDescription())
                .previewAssetId(a.getPreviewAssetId())
                .revisionCount(a.getRevisionCount())
                .createdAt(a.getCreatedAt())
                .build();
    }
}
