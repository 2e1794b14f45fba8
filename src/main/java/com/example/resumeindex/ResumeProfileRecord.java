package com.example.resumeindex;

import jakarta.persistence.*;

@Entity
@Table(name = "resume_profiles", indexes = {
        @Index(name = "idx_index_artifact", columnList = "index_artifact_path")
})
public class ResumeProfileRecord {

    // insertion sequence; also the sort key that aligns rows with index positions
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, unique = true)
    private String externalId;

    @Column(name = "source_path")
    private String sourcePath;

    @Column(name = "display_name")
    private String displayName;

    @Lob
    @Column(name = "profile_json", nullable = false, columnDefinition = "CLOB")
    private String profileJson;

    @Column(name = "provenance_tag", nullable = false)
    private String provenanceTag;

    // null until a backfill attaches this row to an artifact
    @Column(name = "index_artifact_path")
    private String indexArtifactPath;

    // ISO-8601 UTC
    @Column(name = "created_at", nullable = false)
    private String createdAt;

    @Column(name = "updated_at", nullable = false)
    private String updatedAt;

    public ResumeProfileRecord() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getSourcePath() { return sourcePath; }
    public void setSourcePath(String sourcePath) { this.sourcePath = sourcePath; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public String getProfileJson() { return profileJson; }
    public void setProfileJson(String profileJson) { this.profileJson = profileJson; }
    public String getProvenanceTag() { return provenanceTag; }
    public void setProvenanceTag(String provenanceTag) { this.provenanceTag = provenanceTag; }
    public String getIndexArtifactPath() { return indexArtifactPath; }
    public void setIndexArtifactPath(String indexArtifactPath) { this.indexArtifactPath = indexArtifactPath; }
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
    public String getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(String updatedAt) { this.updatedAt = updatedAt; }
}
