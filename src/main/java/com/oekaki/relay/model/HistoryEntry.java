package com.oekaki.relay.model;

import jakarta.persistence.*;
import lombok.*;

/** Append-only record of one accepted revision. */
@Entity
@Table(name = "histories", indexes = {
        @Index(name = "idx_histories_image_id", columnList = "image_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoryEntry {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 20)
    private String author;

    @Column(name = "ip", length = Artifact.ADDRESS_MAX_LENGTH)
    private String submitterAddress;

    @Column(name = "image_id", nullable = false, length = 36)
    private String artifactId;

    @Column(name = "created_at", nullable = false)
    private long createdAt;
}
