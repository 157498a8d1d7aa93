package com.oekaki.relay.service;

import com.oekaki.relay.dto.PreviewAsset;
import com.oekaki.relay.dto.ValidatedSubmission;
import com.oekaki.relay.exception.StoreException;
import com.oekaki.relay.model.Artifact;
import com.oekaki.relay.model.HistoryEntry;
import com.oekaki.relay.repository.ArtifactRepository;
import com.oekaki.relay.repository.HistoryEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational side of a drawing: the artifact row and its history. Every call is its
 * own unit of work; persistence faults come back as {@link StoreException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataService {

    private final ArtifactRepository artifacts;
    private final HistoryEntryRepository histories;

    public Optional<Artifact> findArtifact(String artifactId) {
        try {
            return artifacts.findById(artifactId);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to load artifact " + artifactId, e);
        }
    }

    public Artifact createArtifact(String artifactId,
                                   ValidatedSubmission submission,
                                   String submitterAddress,
                                   PreviewAsset preview,
                                   long now) {
        Artifact artifact = Artifact.builder()
                .id(artifactId)
                .author(submission.getAuthor())
                .submitterAddress(submitterAddress)
                .description(submission.getDescription())
                .previewAssetId(preview.getAssetId())
                .previewDeleteToken(preview.getDeleteToken())
                .revisionCount(1)
                .createdAt(now)
                .build();
        try {
            return artifacts.save(artifact);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to insert artifact " + artifactId, e);
        }
    }

    /**
     * Points the artifact at its new preview and counts the revision, provided nobody
     * else revised it since {@code current} was read.
     *
     * @return false if the row moved on (or hit the cap) in the meantime
     */
    public boolean reviseArtifact(Artifact current, PreviewAsset preview, long now) {
        try {
            int updated = artifacts.reviseIfCountMatches(
                    current.getId(),
                    current.getRevisionCount(),
                    Artifact.REVISION_CAP,
                    preview.getAssetId(),
                    preview.getDeleteToken(),
                    now);
            return updated == 1;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to update artifact " + current.getId(), e);
        }
    }

    public HistoryEntry appendHistory(String artifactId, String author, String submitterAddress, long now) {
        HistoryEntry entry = HistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .author(author)
                .submitterAddress(submitterAddress)
                .artifactId(artifactId)
                .createdAt(now)
                .build();
        try {
            return histories.save(entry);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to append history for " + artifactId, e);
        }
    }

    /** Deletes the artifact row and all of its history. Safe to call when none exist. */
    public void rollback(String artifactId) {
        try {
            int artifactRows = artifacts.deleteArtifact(artifactId);
            int historyRows = histories.deleteByArtifactId(artifactId);
            log.warn("Rolled back artifact {} ({} artifact rows, {} history rows)", artifactId, artifactRows, historyRows);
        } catch (DataAccessException e) {
            throw new StoreException("Rollback failed for " + artifactId, e);
        }
    }

    public List<Artifact> listRecent(int page, int pageSize) {
        try {
            return artifacts.findAllByOrderByCreatedAtDesc(PageRequest.of(page, pageSize));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list artifacts", e);
        }
    }

    public List<HistoryEntry> listHistory(String artifactId) {
        try {
            return histories.findByArtifactIdOrderByCreatedAtAsc(artifactId);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list history for " + artifactId, e);
        }
    }
}
