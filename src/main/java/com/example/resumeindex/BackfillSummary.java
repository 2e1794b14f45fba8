package com.example.resumeindex;

import java.util.ArrayList;
import java.util.List;

public class BackfillSummary {

    private String mode;
    private int selectedCount;
    private int pendingCount;
    private int processedCount;
    private String artifactPath;
    private List<Long> updatedIds = new ArrayList<>();

    public static BackfillSummary empty(BackfillMode mode) {
        BackfillSummary s = new BackfillSummary();
        s.setMode(mode.label());
        return s;
    }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public int getSelectedCount() { return selectedCount; }
    public void setSelectedCount(int selectedCount) { this.selectedCount = selectedCount; }
    public int getPendingCount() { return pendingCount; }
    public void setPendingCount(int pendingCount) { this.pendingCount = pendingCount; }
    public int getProcessedCount() { return processedCount; }
    public void setProcessedCount(int processedCount) { this.processedCount = processedCount; }
    public String getArtifactPath() { return artifactPath; }
    public void setArtifactPath(String artifactPath) { this.artifactPath = artifactPath; }
    public List<Long> getUpdatedIds() { return updatedIds; }
    public void setUpdatedIds(List<Long> updatedIds) { this.updatedIds = updatedIds; }
}
