package com.oekaki.relay.service;

import com.oekaki.relay.dto.PreviewAsset;
import com.oekaki.relay.dto.ValidatedSubmission;
import com.oekaki.relay.exception.ArtifactLockedException;
import com.oekaki.relay.exception.ArtifactNotFoundException;
import com.oekaki.relay.exception.OekakiException;
import com.oekaki.relay.exception.StoreException;
import com.oekaki.relay.exception.UpstreamException;
import com.oekaki.relay.model.Artifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs one submission across the preview host, the metadata store and the blob store.
 *
 * <p>There is no transaction spanning the three, so the steps run in a fixed order:
 * resolve target, upload preview, write artifact, append history, write blob. Once a
 * brand new artifact row exists, a later failure deletes that row and its history
 * again. A revision of an existing drawing is never compensated: if history or blob
 * fail after the row was updated, the update stays.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionCoordinator {

    private final MetadataService metadata;
    private final PreviewHostClient previewHost;
    private final BlobStorageService blobs;

    /**
     * @param artifactId drawing to revise, or {@code null} to start a new one
     * @return id of the created or revised drawing
     */
    public String submit(ValidatedSubmission submission, String artifactId, String submitterAddress) {
        Artifact target = artifactId == null ? null : resolveTarget(artifactId);

        PreviewAsset preview = previewHost.upload(submission.getImageData());
        long now = System.currentTimeMillis();

        if (target == null) {
            return createArtifact(submission, submitterAddress, preview, now);
        }
        return reviseArtifact(target, submission, submitterAddress, preview, now);
    }

    private Artifact resolveTarget(String artifactId) {
        Artifact existing = metadata.findArtifact(artifactId)
                .orElseThrow(() -> ArtifactNotFoundException.forRevision(artifactId));
        if (existing.isComplete()) {
            throw new ArtifactLockedException(artifactId);
        }
        return existing;
    }

    private String createArtifact(ValidatedSubmission submission, String submitterAddress, PreviewAsset preview, long now) {
        String artifactId = UUID.randomUUID().toString();
        metadata.createArtifact(artifactId, submission, submitterAddress, preview, now);
        log.info("Created artifact {} (preview {})", artifactId, preview.getAssetId());

        try {
            metadata.appendHistory(artifactId, submission.getAuthor(), submitterAddress, now);
        } catch (RuntimeException e) {
            throw compensate(artifactId, "history", e);
        }

        try {
            blobs.putPayload(artifactId, submission.getBody());
        } catch (RuntimeException e) {
            throw compensate(artifactId, "blob", e);
        }

        return artifactId;
    }

    private String reviseArtifact(Artifact target,
                                  ValidatedSubmission submission,
                                  String submitterAddress,
                                  PreviewAsset preview,
                                  long now) {
        String artifactId = target.getId();

        // the previous preview is dropped before the row points at the new one
        previewHost.delete(target.getPreviewDeleteToken());

        if (!metadata.reviseArtifact(target, preview, now)) {
            throw lostRevisionRace(target, preview);
        }
        log.info("Revised artifact {} to revision {} (preview {})",
                artifactId, target.getRevisionCount() + 1, preview.getAssetId());

        try {
            metadata.appendHistory(artifactId, submission.getAuthor(), submitterAddress, now);
        } catch (StoreException e) {
            log.error("History append failed for revised artifact {}; revision kept", artifactId, e);
            throw e;
        }

        try {
            blobs.putPayload(artifactId, submission.getBody());
        } catch (RuntimeException e) {
            log.error("Blob write failed for revised artifact {}; revision kept", artifactId, e);
            throw asStoreFailure(artifactId, e);
        }

        return artifactId;
    }

    /**
     * Another submission revised the row between our read and our update. Our upload is
     * now unreferenced, so it is removed before reporting the outcome.
     */
    private OekakiException lostRevisionRace(Artifact target, PreviewAsset preview) {
        String artifactId = target.getId();
        try {
            previewHost.delete(preview.getDeleteToken());
        } catch (UpstreamException e) {
            log.warn("Could not remove unreferenced preview {} for {}", preview.getAssetId(), artifactId, e);
        }

        Artifact now = metadata.findArtifact(artifactId).orElse(null);
        if (now == null) {
            return ArtifactNotFoundException.forRevision(artifactId);
        }
        if (now.isComplete()) {
            return new ArtifactLockedException(artifactId);
        }
        return new StoreException("Concurrent revision of artifact " + artifactId
                + " (expected count " + target.getRevisionCount() + ", found " + now.getRevisionCount() + ")");
    }

    private OekakiException compensate(String artifactId, String step, RuntimeException cause) {
        OekakiException failure = asStoreFailure(artifactId, cause);
        log.error("{} write failed for new artifact {}, rolling back", step, artifactId, cause);
        try {
            metadata.rollback(artifactId);
        } catch (RuntimeException rollbackFailure) {
            log.error("Rollback of artifact {} failed", artifactId, rollbackFailure);
            failure.addSuppressed(rollbackFailure);
        }
        return failure;
    }

    private static OekakiException asStoreFailure(String artifactId, RuntimeException e) {
        if (e instanceof OekakiException oe) {
            return oe;
        }
        return new StoreException("Submission for artifact " + artifactId + " failed", e);
    }
}
