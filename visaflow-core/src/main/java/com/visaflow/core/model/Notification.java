package com.visaflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * User-facing notification raised by the engine, the actions or the folder watcher.
 */
public record Notification(
    String id,
    NotificationLevel level,
    String title,
    String message,
    Instant timestamp,
    String documentId,
    String instanceId
) {
    public static Notification of(
            NotificationLevel level, String title, String message,
            Instant timestamp, String documentId, String instanceId) {
        return new Notification(UUID.randomUUID().toString(), level, title, message, timestamp, documentId, instanceId);
    }
}
