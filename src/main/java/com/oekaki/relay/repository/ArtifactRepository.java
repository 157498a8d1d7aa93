package com.oekaki.relay.repository;

import com.oekaki.relay.model.Artifact;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface ArtifactRepository extends JpaRepository<Artifact, String> {

    List<Artifact> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Moves the preview to a new asset and bumps the revision count, but only if the
     * row still holds {@code expectedCount} and is below {@code cap}.
     *
     * @return number of rows updated, 0 when another revision got there first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           update Artifact a
              set a.previewAssetId = :assetId,
                  a.previewDeleteToken = :deleteToken,
                  a.revisionCount = a.revisionCount + 1,
                  a.createdAt = :revisedAt
            where a.id = :id
              and a.revisionCount = :expectedCount
              and a.revisionCount < :cap
           """)
    int reviseIfCountMatches(@Param("id") String id,
                             @Param("expectedCount") int expectedCount,
                             @Param("cap") int cap,
                             @Param("assetId") String assetId,
                             @Param("deleteToken") String deleteToken,
                             @Param("revisedAt") long revisedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from Artifact a where a.id = :id")
    int deleteArtifact(@Param("id") String id);
}
