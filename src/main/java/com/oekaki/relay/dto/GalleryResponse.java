package com.oekaki.relay.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GalleryResponse {
    private boolean success;
    private int page;
    private List<ArtifactSummary> images;
}
