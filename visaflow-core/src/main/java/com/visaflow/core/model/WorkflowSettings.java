package com.visaflow.core.model;

/**
 * Global settings of a workflow definition.
 */
public record WorkflowSettings(
    String sourceFolderId,
    String targetFolderId,
    String rejectedFolderId,
    boolean autoStartOnUpload,
    boolean notifyOnStatusChange,
    boolean allowResubmission,
    Integer maxReviewDays,
    boolean parallelReview
) {
    public static WorkflowSettings defaults() {
        return new WorkflowSettings(null, null, null, false, false, true, null, false);
    }

    public boolean hasSourceFolder() {
        return sourceFolderId != null && !sourceFolderId.isBlank();
    }

    public WorkflowSettings withFolders(String sourceFolderId, String targetFolderId, String rejectedFolderId) {
        return new WorkflowSettings(sourceFolderId, targetFolderId, rejectedFolderId,
            autoStartOnUpload, notifyOnStatusChange, allowResubmission, maxReviewDays, parallelReview);
    }

    public WorkflowSettings withAutoStartOnUpload(boolean autoStartOnUpload) {
        return new WorkflowSettings(sourceFolderId, targetFolderId, rejectedFolderId,
            autoStartOnUpload, notifyOnStatusChange, allowResubmission, maxReviewDays, parallelReview);
    }

    public WorkflowSettings withNotifyOnStatusChange(boolean notifyOnStatusChange) {
        return new WorkflowSettings(sourceFolderId, targetFolderId, rejectedFolderId,
            autoStartOnUpload, notifyOnStatusChange, allowResubmission, maxReviewDays, parallelReview);
    }
}
