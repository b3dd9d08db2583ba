package com.visaflow.core.model;

/**
 * Severity of a user-facing notification.
 */
public enum NotificationLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
