package com.oekaki.relay.service;

import com.oekaki.relay.dto.PreviewAsset;
import com.oekaki.relay.dto.ValidatedSubmission;
import com.oekaki.relay.exception.ArtifactLockedException;
import com.oekaki.relay.exception.ArtifactNotFoundException;
import com.oekaki.relay.exception.StoreException;
import com.oekaki.relay.exception.UpstreamException;
import com.oekaki.relay.model.Artifact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SubmissionCoordinator.
 *
 * Covers step ordering, the new-artifact rollback and the deliberately
 * uncompensated revision path.
 */
@ExtendWith(MockitoExtension.class)
class SubmissionCoordinatorTest {

    private static final byte[] BODY = {1, 2, 3};
    private static final PreviewAsset NEW_PREVIEW = new PreviewAsset("newAsset", "newToken");

    @Mock
    private MetadataService metadata;

    @Mock
    private PreviewHostClient previewHost;

    @Mock
    private BlobStorageService blobs;

    @InjectMocks
    private SubmissionCoordinator coordinator;

    private final ValidatedSubmission submission =
            new ValidatedSubmission("alice", "cat", "data:image/png;base64,AAAA", BODY);

    private static Artifact existing(int count) {
        return Artifact.builder()
                .id("art-1")
                .author("bob")
                .previewAssetId("oldAsset")
                .previewDeleteToken("oldToken")
                .revisionCount(count)
                .createdAt(1L)
                .build();
    }

    @Test
    @DisplayName("New submission: upload, insert, history, blob, returns fresh id")
    void createsNewArtifact() {
        when(previewHost.upload(submission.getImageData())).thenReturn(NEW_PREVIEW);

        String id = coordinator.submit(submission, null, "10.0.0.1");

        assertThat(id).isNotBlank();
        var order = inOrder(previewHost, metadata, blobs);
        order.verify(previewHost).upload(submission.getImageData());
        order.verify(metadata).createArtifact(eq(id), eq(submission), eq("10.0.0.1"), eq(NEW_PREVIEW), anyLong());
        order.verify(metadata).appendHistory(eq(id), eq("alice"), eq("10.0.0.1"), anyLong());
        order.verify(blobs).putPayload(id, BODY);
        verify(metadata, never()).rollback(anyString());
        verify(previewHost, never()).delete(anyString());
    }

    @Test
    void previewFailureAbortsBeforeAnyWrite() {
        when(previewHost.upload(anyString())).thenThrow(new UpstreamException("503"));

        assertThatThrownBy(() -> coordinator.submit(submission, null, "ip"))
                .isInstanceOf(UpstreamException.class);

        verifyNoInteractions(metadata, blobs);
    }

    @Test
    void artifactInsertFailureNeedsNoCompensation() {
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.createArtifact(anyString(), any(), any(), any(), anyLong()))
                .thenThrow(new StoreException("insert failed"));

        assertThatThrownBy(() -> coordinator.submit(submission, null, "ip"))
                .isInstanceOf(StoreException.class);

        verify(metadata, never()).appendHistory(any(), any(), any(), anyLong());
        verify(metadata, never()).rollback(anyString());
        verifyNoInteractions(blobs);
    }

    @Test
    @DisplayName("History failure on a new artifact rolls the artifact back")
    void historyFailureOnNewArtifactRollsBack() {
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.appendHistory(anyString(), any(), any(), anyLong()))
                .thenThrow(new StoreException("history failed"));

        assertThatThrownBy(() -> coordinator.submit(submission, null, "ip"))
                .isInstanceOf(StoreException.class);

        ArgumentCaptor<String> created = ArgumentCaptor.forClass(String.class);
        verify(metadata).createArtifact(created.capture(), any(), any(), any(), anyLong());
        verify(metadata).rollback(created.getValue());
        verifyNoInteractions(blobs);
    }

    @Test
    @DisplayName("Blob fault on a new artifact rolls the artifact back and reports a store error")
    void blobFaultOnNewArtifactRollsBack() {
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(blobs.putPayload(anyString(), any())).thenThrow(new IllegalStateException("bucket gone"));

        assertThatThrownBy(() -> coordinator.submit(submission, null, "ip"))
                .isInstanceOf(StoreException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        ArgumentCaptor<String> created = ArgumentCaptor.forClass(String.class);
        verify(metadata).createArtifact(created.capture(), any(), any(), any(), anyLong());
        verify(metadata).rollback(created.getValue());
    }

    @Test
    void failedRollbackIsAttachedToTheOriginalError() {
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        StoreException blobFailure = new StoreException("blob failed");
        when(blobs.putPayload(anyString(), any())).thenThrow(blobFailure);
        doThrow(new StoreException("db down")).when(metadata).rollback(anyString());

        assertThatThrownBy(() -> coordinator.submit(submission, null, "ip"))
                .isSameAs(blobFailure)
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    @Test
    void unknownIdIsRejectedWithoutTouchingAnything() {
        when(metadata.findArtifact("missing")).thenReturn(Optional.empty());

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> coordinator.submit(submission, "missing", "ip"))
                    .isInstanceOf(ArtifactNotFoundException.class)
                    .extracting("reason").isEqualTo("invalid image id");
        }

        verifyNoInteractions(previewHost, blobs);
        verify(metadata, never()).reviseArtifact(any(), any(), anyLong());
    }

    @Test
    @DisplayName("A drawing at the revision cap is locked and nothing is mutated")
    void completedArtifactIsLocked() {
        when(metadata.findArtifact("art-1")).thenReturn(Optional.of(existing(10)));

        assertThatThrownBy(() -> coordinator.submit(submission, "art-1", "ip"))
                .isInstanceOf(ArtifactLockedException.class);

        verifyNoInteractions(previewHost, blobs);
        verify(metadata, never()).reviseArtifact(any(), any(), anyLong());
        verify(metadata, never()).appendHistory(any(), any(), any(), anyLong());
    }

    @Test
    @DisplayName("Revision deletes the old preview, then updates, appends history and writes the blob")
    void revisesExistingArtifact() {
        Artifact current = existing(9);
        when(metadata.findArtifact("art-1")).thenReturn(Optional.of(current));
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.reviseArtifact(eq(current), eq(NEW_PREVIEW), anyLong())).thenReturn(true);

        assertThat(coordinator.submit(submission, "art-1", "ip")).isEqualTo("art-1");

        var order = inOrder(previewHost, metadata, blobs);
        order.verify(previewHost).upload(anyString());
        order.verify(previewHost).delete("oldToken");
        order.verify(metadata).reviseArtifact(eq(current), eq(NEW_PREVIEW), anyLong());
        order.verify(metadata).appendHistory(eq("art-1"), eq("alice"), eq("ip"), anyLong());
        order.verify(blobs).putPayload("art-1", BODY);
    }

    @Test
    void oldPreviewDeleteFailureAbortsBeforeUpdate() {
        when(metadata.findArtifact("art-1")).thenReturn(Optional.of(existing(3)));
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        doThrow(new UpstreamException("404")).when(previewHost).delete("oldToken");

        assertThatThrownBy(() -> coordinator.submit(submission, "art-1", "ip"))
                .isInstanceOf(UpstreamException.class);

        verify(metadata, never()).reviseArtifact(any(), any(), anyLong());
        verifyNoInteractions(blobs);
    }

    @Test
    @DisplayName("History failure on a revision keeps the revision (no rollback)")
    void historyFailureOnRevisionIsNotCompensated() {
        Artifact current = existing(4);
        when(metadata.findArtifact("art-1")).thenReturn(Optional.of(current));
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.reviseArtifact(any(), any(), anyLong())).thenReturn(true);
        when(metadata.appendHistory(anyString(), any(), any(), anyLong()))
                .thenThrow(new StoreException("history failed"));

        assertThatThrownBy(() -> coordinator.submit(submission, "art-1", "ip"))
                .isInstanceOf(StoreException.class);

        verify(metadata, never()).rollback(anyString());
        verifyNoInteractions(blobs);
    }

    @Test
    void blobFailureOnRevisionIsNotCompensated() {
        when(metadata.findArtifact("art-1")).thenReturn(Optional.of(existing(4)));
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.reviseArtifact(any(), any(), anyLong())).thenReturn(true);
        when(blobs.putPayload(anyString(), any())).thenThrow(new StoreException("blob failed"));

        assertThatThrownBy(() -> coordinator.submit(submission, "art-1", "ip"))
                .isInstanceOf(StoreException.class);

        verify(metadata, never()).rollback(anyString());
    }

    @Test
    @DisplayName("Losing the revision race at the cap reports locked and drops the unused upload")
    void lostRaceAtCapIsLocked() {
        when(metadata.findArtifact("art-1"))
                .thenReturn(Optional.of(existing(9)))
                .thenReturn(Optional.of(existing(10)));
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.reviseArtifact(any(), any(), anyLong())).thenReturn(false);

        assertThatThrownBy(() -> coordinator.submit(submission, "art-1", "ip"))
                .isInstanceOf(ArtifactLockedException.class);

        verify(previewHost).delete("newToken");
        verify(metadata, never()).appendHistory(any(), any(), any(), anyLong());
        verifyNoInteractions(blobs);
    }

    @Test
    void lostRaceBelowCapIsAStoreError() {
        when(metadata.findArtifact("art-1"))
                .thenReturn(Optional.of(existing(5)))
                .thenReturn(Optional.of(existing(6)));
        when(previewHost.upload(anyString())).thenReturn(NEW_PREVIEW);
        when(metadata.reviseArtifact(any(), any(), anyLong())).thenReturn(false);

        assertThatThrownBy(() -> coordinator.submit(submission, "art-1", "ip"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Concurrent revision");

        verify(previewHost).delete("newToken");
        verifyNoInteractions(blobs);
    }
}
