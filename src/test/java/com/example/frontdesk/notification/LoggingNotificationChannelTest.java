package com.example.frontdesk.notification;

import com.example.frontdesk.store.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

public class LoggingNotificationChannelTest {

    @Test
    void keepsNewestFirst_boundedByCapacity() {
        var channel = new LoggingNotificationChannel(2, new MutableClock(Instant.parse("2026-01-05T10:00:00Z")));

        channel.notifySupervisor("first", 1L);
        channel.notifyCaller("+1555", "second");
        channel.notifySupervisor("third", 3L);

        assertThat(channel.recent()).extracting(NotificationRecord::message).containsExactly("third", "second");
        assertThat(channel.recent().get(1).type()).isEqualTo(NotificationRecord.Type.CALLER_FOLLOWUP);
        assertThat(channel.recent().get(1).target()).isEqualTo("+1555");
    }
}
