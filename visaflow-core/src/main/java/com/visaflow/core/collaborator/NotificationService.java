package com.visaflow.core.collaborator;

import com.visaflow.core.model.Notification;

/**
 * Sink for user-facing notifications. Fire-and-forget:
 * callers log failures and never propagate them.
 */
@FunctionalInterface
public interface NotificationService {

    void notify(Notification notification);
}
