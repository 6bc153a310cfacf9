package com.example.frontdesk.notification;

import java.time.Instant;

/**
 * One delivered notification, as kept by {@link LoggingNotificationChannel}.
 */
public record NotificationRecord(Type type, Instant timestamp, String target, Long requestId, String message) {

    public enum Type {
        SUPERVISOR_ALERT,
        CALLER_FOLLOWUP
    }
}
