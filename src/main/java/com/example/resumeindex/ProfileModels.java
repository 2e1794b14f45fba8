package com.example.resumeindex;

import com.fasterxml.jackson.databind.JsonNode;

public class ProfileModels {

    public static class UpsertRequest {
        private String provenanceTag;
        private String sourcePath;
        private JsonNode profile;

        public String getProvenanceTag() { return provenanceTag; }
        public void setProvenanceTag(String provenanceTag) { this.provenanceTag = provenanceTag; }
        public String getSourcePath() { return sourcePath; }
        public void setSourcePath(String sourcePath) { this.sourcePath = sourcePath; }
        public JsonNode getProfile() { return profile; }
        public void setProfile(JsonNode profile) { this.profile = profile; }
    }

    public static class ProfileSummary {
        private Long id;
        private String externalId;
        private String displayName;
        private String provenanceTag;
        private String indexArtifactPath;
        private String createdAt;
        private String updatedAt;

        public static ProfileSummary of(ResumeProfileRecord r) {
            ProfileSummary s = new ProfileSummary();
            s.setId(r.getId());
            s.setExternalId(r.getExternalId());
            s.setDisplayName(r.getDisplayName());
            s.setProvenanceTag(r.getProvenanceTag());
            s.setIndexArtifactPath(r.getIndexArtifactPath());
            s.setCreatedAt(r.getCreatedAt());
            s.setUpdatedAt(r.getUpdatedAt());
            return s;
        }

        public Long getId() { return id; }
        public void setId(Long id) { this.id = id; }
        public String getExternalId() { return externalId; }
        public void setExternalId(String externalId) { this.externalId = externalId; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getProvenanceTag() { return provenanceTag; }
        public void setProvenanceTag(String provenanceTag) { this.provenanceTag = provenanceTag; }
        public String getIndexArtifactPath() { return indexArtifactPath; }
        public void setIndexArtifactPath(String indexArtifactPath) { this.indexArtifactPath = indexArtifactPath; }
        public String getCreatedAt() { return createdAt; }
        public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }
        public String getUpdatedAt() { return updatedAt; }
        public void setUpdatedAt(String updatedAt) { this.updatedAt = updatedAt; }
    }

    public static class FlattenedProfile {
        private Long id;
        private String externalId;
        private String flattenedText;

        public Long getId() { return id; }
        public void setId(Long id) { this.id = id; }
        public String getExternalId() { return externalId; }
        public void setExternalId(String externalId) { this.externalId = externalId; }
        public String getFlattenedText() { return flattenedText; }
        public void setFlattenedText(String flattenedText) { this.flattenedText = flattenedText; }
    }
}
