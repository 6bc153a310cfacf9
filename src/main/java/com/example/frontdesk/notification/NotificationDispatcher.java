package com.example.frontdesk.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget front of the {@link NotificationChannel}.
 *
 * <p>Delivery runs on the notification pool. Failures, including a saturated pool, are logged and
 * dropped; the state change that triggered the notification is already committed.</p>
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final NotificationChannel channel;
    private final Executor executor;

    public NotificationDispatcher(NotificationChannel channel,
                                  @Qualifier("notificationExecutor") Executor executor) {
        this.channel = channel;
        this.executor = executor;
    }

    public void supervisorAlert(String renderedMessage, Long requestId) {
        submit("supervisor request=" + requestId, () -> channel.notifySupervisor(renderedMessage, requestId));
    }

    public void callerFollowUp(String contactAddress, String renderedMessage) {
        submit("caller " + contactAddress, () -> channel.notifyCaller(contactAddress, renderedMessage));
    }

    private void submit(String what, Runnable delivery) {
        try {
            executor.execute(() -> {
                try {
                    delivery.run();
                } catch (RuntimeException e) {
                    log.warn("[NOTIFY] delivery failed ({}): {}", what, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[NOTIFY] dropped, executor saturated ({})", what);
        }
    }
}
