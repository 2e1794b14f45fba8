package com.example.resumeindex;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ResumeProfileRepository extends JpaRepository<ResumeProfileRecord, Long> {

    Optional<ResumeProfileRecord> findByExternalId(String externalId);

    List<ResumeProfileRecord> findAllByOrderByIdAsc();

    List<ResumeProfileRecord> findByIndexArtifactPathIsNullOrderByIdAsc();

    List<ResumeProfileRecord> findByIndexArtifactPathOrderByIdAsc(String indexArtifactPath);

    long countByIndexArtifactPathIsNull();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ResumeProfileRecord r set r.indexArtifactPath = :artifact, r.updatedAt = :updatedAt where r.id in :ids")
    int attachIndexArtifact(@Param("ids") Collection<Long> ids,
                            @Param("artifact") String artifact,
                            @Param("updatedAt") String updatedAt);
}
