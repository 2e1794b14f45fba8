package com.example.resumeindex;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class QueryModels {

    /** One nearest neighbor. Identity fields stay null when the position has no mapped row. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Neighbor {
        private int rank;
        private float distance;
        private int indexPosition;
        private Long id;
        private String externalId;
        private String displayName;

        public int getRank() { return rank; }
        public void setRank(int rank) { this.rank = rank; }
        public float getDistance() { return distance; }
        public void setDistance(float distance) { this.distance = distance; }
        public int getIndexPosition() { return indexPosition; }
        public void setIndexPosition(int indexPosition) { this.indexPosition = indexPosition; }
        public Long getId() { return id; }
        public void setId(Long id) { this.id = id; }
        public String getExternalId() { return externalId; }
        public void setExternalId(String externalId) { this.externalId = externalId; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public boolean isResolved() { return id != null; }
    }

    public static class VectorQueryRequest {
        private float[] vector;
        private String artifactPath;  // optional, latest artifact when absent
        private int topK;
        private boolean resolveRecords = true;

        public float[] getVector() { return vector; }
        public void setVector(float[] vector) { this.vector = vector; }
        public String getArtifactPath() { return artifactPath; }
        public void setArtifactPath(String artifactPath) { this.artifactPath = artifactPath; }
        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }
        public boolean isResolveRecords() { return resolveRecords; }
        public void setResolveRecords(boolean resolveRecords) { this.resolveRecords = resolveRecords; }
    }

    public static class ProfileQueryRequest {
        private JsonNode profile;
        private String artifactPath;
        private int topK;
        private String model;

        public JsonNode getProfile() { return profile; }
        public void setProfile(JsonNode profile) { this.profile = profile; }
        public String getArtifactPath() { return artifactPath; }
        public void setArtifactPath(String artifactPath) { this.artifactPath = artifactPath; }
        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class QueryResponse {
        private String artifactPath;
        private int requestedTopK;
        private List<Neighbor> neighbors;

        public String getArtifactPath() { return artifactPath; }
        public void setArtifactPath(String artifactPath) { this.artifactPath = artifactPath; }
        public int getRequestedTopK() { return requestedTopK; }
        public void setRequestedTopK(int requestedTopK) { this.requestedTopK = requestedTopK; }
        public List<Neighbor> getNeighbors() { return neighbors; }
        public void setNeighbors(List<Neighbor> neighbors) { this.neighbors = neighbors; }
    }
}
