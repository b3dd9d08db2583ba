package com.visaflow.core.model;

import java.time.Instant;

/**
 * Status currently displayed for a document.
 */
public record DocumentStatus(
    String id,
    String name,
    String color,
    Instant changedAt,
    String changedBy
) {
    public static final String PENDING_ID = "pending";

    /**
     * Status given to documents detected in a watched folder.
     */
    public static DocumentStatus pending(Instant now) {
        return new DocumentStatus(PENDING_ID, "En attente", "#6a6e79", now, WorkflowHistoryEntry.SYSTEM_USER_NAME);
    }

    public static DocumentStatus of(WorkflowStatus status, Instant changedAt, String changedBy) {
        return new DocumentStatus(status.id(), status.name(), status.color(), changedAt, changedBy);
    }
}
