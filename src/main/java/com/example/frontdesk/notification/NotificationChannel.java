package com.example.frontdesk.notification;

/**
 * Outbound delivery to the supervisor and to callers (SMS, chat, e-mail...).
 *
 * <p>Implementations may block and may throw; callers go through {@link NotificationDispatcher},
 * which runs them off the request thread and never lets a failure reach a state transition.</p>
 */
public interface NotificationChannel {

    void notifySupervisor(String renderedMessage, Long requestId);

    void notifyCaller(String contactAddress, String renderedMessage);
}
