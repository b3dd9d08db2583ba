package com.visaflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record of one transition of a workflow instance.
 * Append-only: entries are never modified, reordered or removed.
 */
public record WorkflowHistoryEntry(
    String id,
    Instant timestamp,
    String fromNodeId,
    String toNodeId,
    String fromStatusId,
    String toStatusId,
    String userId,
    String userName,
    String action,
    String comment
) {
    public static final String SYSTEM_USER_ID = "system";
    public static final String SYSTEM_USER_NAME = "Système";
    public static final String ACTION_STARTED = "Workflow démarré";

    /**
     * Entry recorded when an instance is created on its start node.
     */
    public static WorkflowHistoryEntry started(
            Instant timestamp, String startNodeId, String statusId, String userId, String userName) {
        return new WorkflowHistoryEntry(
            UUID.randomUUID().toString(),
            timestamp,
            "",
            startNodeId,
            "",
            statusId,
            userId,
            userName,
            ACTION_STARTED,
            null
        );
    }

    /**
     * Entry recorded by the engine for an automatic transition.
     */
    public static WorkflowHistoryEntry system(
            Instant timestamp, String fromNodeId, String toNodeId,
            String fromStatusId, String toStatusId, String action) {
        return new WorkflowHistoryEntry(
            UUID.randomUUID().toString(),
            timestamp,
            fromNodeId,
            toNodeId,
            fromStatusId,
            toStatusId,
            SYSTEM_USER_ID,
            SYSTEM_USER_NAME,
            action,
            null
        );
    }
}
