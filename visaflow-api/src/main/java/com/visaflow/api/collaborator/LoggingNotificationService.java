package com.visaflow.api.collaborator;

import com.visaflow.core.collaborator.NotificationService;
import com.visaflow.core.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log. Stand-in until a delivery channel is configured.
 */
public class LoggingNotificationService implements NotificationService {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationService.class);

    @Override
    public void notify(Notification notification) {
        switch (notification.level()) {
            case WARNING, ERROR -> log.warn("[{}] {}: {} (document={})",
                notification.level(), notification.title(), notification.message(), notification.documentId());
            default -> log.info("[{}] {}: {} (document={})",
                notification.level(), notification.title(), notification.message(), notification.documentId());
        }
    }
}
