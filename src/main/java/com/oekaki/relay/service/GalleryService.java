package com.oekaki.relay.service;

import com.oekaki.relay.dto.ArtifactDetail;
import com.oekaki.relay.dto.ArtifactSummary;
import com.oekaki.relay.dto.HistoryView;
import com.oekaki.relay.exception.ArtifactNotFoundException;
import com.oekaki.relay.model.Artifact;
import com.oekaki.relay.model.HistoryEntry;
import com.oekaki.relay.util.PayloadFrame;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class GalleryService {

    public static final int PAGE_SIZE = 50;
    /** Highest page whose row offset still fits an int. */
    public static final int MAX_PAGE = Integer.MAX_VALUE / PAGE_SIZE - 1;

    private final MetadataService metadata;
    private final BlobStorageService blobs;

    /** Newest drawings first. */
    public List<ArtifactSummary> listRecent(int page) {
        return metadata.listRecent(clampPage(page), PAGE_SIZE).stream()
                .map(ArtifactSummary::from)
                .toList();
    }

    public static int clampPage(int page) {
        return Math.min(Math.max(page, 0), MAX_PAGE);
    }

    /** Revisions of one drawing, oldest first. */
    public List<HistoryView> listHistory(String artifactId) {
        List<HistoryEntry> entries = metadata.listHistory(artifactId);
        if (entries.isEmpty()) {
            throw ArtifactNotFoundException.forRead(artifactId);
        }
        return entries.stream().map(HistoryView::from).toList();
    }

    public ArtifactDetail getArtifact(String artifactId) {
        Artifact artifact = metadata.findArtifact(artifactId)
                .orElseThrow(() -> ArtifactNotFoundException.forRead(artifactId));

        Optional<byte[]> blob = blobs.getPayload(artifactId);
        List<Integer> payload = blob.map(PayloadFrame::toUnsignedList).orElse(Collections.emptyList());
        String type = blob.isPresent() ? ArtifactDetail.TYPE_BIN : ArtifactDetail.TYPE_FALLBACK;

        return new ArtifactDetail(ArtifactSummary.from(artifact), payload, type);
    }
}
