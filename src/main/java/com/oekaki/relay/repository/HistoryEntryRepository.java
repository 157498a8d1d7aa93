package com.oekaki.relay.repository;

import com.oekaki.relay.model.HistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, String> {

    List<HistoryEntry> findByArtifactIdOrderByCreatedAtAsc(String artifactId);

    long countByArtifactId(String artifactId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from HistoryEntry h where h.artifactId = :artifactId")
    int deleteByArtifactId(@Param("artifactId") String artifactId);
}
