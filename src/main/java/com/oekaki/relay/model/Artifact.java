package com.oekaki.relay.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * One drawing and its current revision state.
 *
 * <p>{@code createdAt} is refreshed on every accepted revision, so it doubles as
 * the last-modified stamp used to order the gallery.
 */
@Entity
@Table(name = "images", indexes = {
        @Index(name = "idx_images_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Artifact {

    /** Revisions accepted per drawing before it is locked. */
    public static final int REVISION_CAP = 10;

    public static final int ADDRESS_MAX_LENGTH = 64;

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 20)
    private String author;

    @Column(name = "ip", length = ADDRESS_MAX_LENGTH)
    private String submitterAddress;

    @Column(length = 20)
    private String description;

    @Column(name = "preview_asset_id", length = 128)
    private String previewAssetId;

    @Column(name = "preview_delete_token", length = 128)
    private String previewDeleteToken;

    @Column(name = "revision_count", nullable = false)
    private int revisionCount;

    @Column(name = "created_at", nullable = false)
    private long createdAt;

    public boolean isComplete() {
        return revisionCount >= REVISION_CAP;
    }
}
