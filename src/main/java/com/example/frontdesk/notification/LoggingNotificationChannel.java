package com.example.frontdesk.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default channel: writes every notification to the log and keeps the most recent ones in memory
 * for the dashboard. Swap in an SMS/Slack implementation by declaring another
 * {@link NotificationChannel} bean.
 */
@Slf4j
@Component
public class LoggingNotificationChannel implements NotificationChannel {

    private final Deque<NotificationRecord> recent = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int capacity;
    private final Clock clock;

    public LoggingNotificationChannel(@Value("${frontdesk.notification.log-capacity:500}") int capacity, Clock clock) {
        this.capacity = Math.max(1, capacity);
        this.clock = clock;
    }

    @Override
    public void notifySupervisor(String renderedMessage, Long requestId) {
        log.info("[NOTIFY] supervisor alert request={}\n{}", requestId, renderedMessage);
        remember(new NotificationRecord(NotificationRecord.Type.SUPERVISOR_ALERT, clock.instant(),
                "supervisor", requestId, renderedMessage));
    }

    @Override
    public void notifyCaller(String contactAddress, String renderedMessage) {
        log.info("[NOTIFY] sms to caller={}\n{}", contactAddress, renderedMessage);
        remember(new NotificationRecord(NotificationRecord.Type.CALLER_FOLLOWUP, clock.instant(),
                contactAddress, null, renderedMessage));
    }

    /** Newest first. */
    public List<NotificationRecord> recent() {
        return new ArrayList<>(recent);
    }

    private void remember(NotificationRecord record) {
        recent.addFirst(record);
        if (size.incrementAndGet() > capacity) {
            if (recent.pollLast() != null) {
                size.decrementAndGet();
            }
        }
    }
}
