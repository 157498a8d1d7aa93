package com.oekaki.relay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.oekaki.relay.model.HistoryEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryView {
    private String id;
    private String author;
    @JsonProperty("ip")
    private String submitterAddress;
    @JsonProperty("image_id")
    private String artifactId;
    @JsonProperty("created_at")
    private long createdAt;

    public static HistoryView from(HistoryEntry h) {
        return HistoryView.builder()
                .id(h.getId())
                .author(h.getAuthor())
                .submitterAddress(h.getSubmitterAddress())
                .artifactId(h.getArtifactId())
                .createdAt(h.getCreatedAt())
                .build();
    }
}
