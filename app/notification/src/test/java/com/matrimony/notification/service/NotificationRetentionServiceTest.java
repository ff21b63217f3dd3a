/*
 * Where: Notification retention tests
 * What: Verifies cleanup deletes only eligible rows
 * Why: Prevent accidental removal of active notifications
 */
package com.matrimony.notification.service;

import com.matrimony.notification.AbstractPostgresContainerTest;
import com.matrimony.notification.config.NotificationRetentionProperties;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.model.NotificationStatus;
import com.matrimony.notification.model.TrackingEvent;
import com.matrimony.notification.model.TrackingEventType;
import com.matrimony.notification.repository.NotificationQueueRepository;
import com.matrimony.notification.repository.ProcessedEventRepository;
import com.matrimony.notification.repository.TrackingEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRetentionServiceTest extends AbstractPostgresContainerTest {

    // Time-sensitive threshold tests are fixed to avoid boundary flakiness.
    private static final Instant FIXED_NOW = Instant.parse("2026-03-10T00:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean(name = "testClock")
        @Primary
        Clock clock() {
            return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private NotificationRetentionService retentionService;

    @Autowired
    private NotificationRetentionProperties retentionProperties;

    @Autowired
    private NotificationQueueRepository queueRepository;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private TrackingEventRepository trackingEventRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notification_queue", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM processed_events", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM tracking_events", new MapSqlParameterSource());
    }

    @Test
    void cleanupRemovesOnlyTerminalRowsPastRetention() {
        int retentionDays = retentionProperties.retentionDays();
        Instant old = FIXED_NOW.minus(Duration.ofDays(retentionDays + 1));
        Instant recent = FIXED_NOW.minus(Duration.ofDays(retentionDays - 1));

        UUID oldSent = queueRepository.insert(item(NotificationStatus.SENT, old));
        UUID oldFailed = queueRepository.insert(item(NotificationStatus.FAILED, old));
        UUID oldSkipped = queueRepository.insert(item(NotificationStatus.SKIPPED, old));
        UUID oldPending = queueRepository.insert(item(NotificationStatus.PENDING, old));
        UUID recentSent = queueRepository.insert(item(NotificationStatus.SENT, recent));
        processedEventRepository.insertIfAbsent(UUID.randomUUID(), old);
        processedEventRepository.insertIfAbsent(UUID.randomUUID(), recent);

        RetentionSummary summary = retentionService.cleanup(
                retentionDays, retentionProperties.trackingRetentionDays());

        assertThat(summary.deletedNotifications()).isEqualTo(3);
        assertThat(summary.deletedProcessedEvents()).isEqualTo(1);
        // 古い PENDING は削除せず件数だけ報告する
        assertThat(summary.staleActive()).isEqualTo(1);
        assertThat(queueRepository.findById(oldSent)).isEmpty();
        assertThat(queueRepository.findById(oldFailed)).isEmpty();
        assertThat(queueRepository.findById(oldSkipped)).isEmpty();
        assertThat(queueRepository.findById(oldPending)).isPresent();
        assertThat(queueRepository.findById(recentSent)).isPresent();
    }

    @Test
    void trackingEventsUseTheirOwnRetentionWindow() {
        int trackingDays = retentionProperties.trackingRetentionDays();
        UUID trackingId = UUID.randomUUID();
        trackingEventRepository.insertClick(click(trackingId, FIXED_NOW.minus(Duration.ofDays(trackingDays + 1))));
        trackingEventRepository.insertClick(click(trackingId, FIXED_NOW.minus(Duration.ofDays(trackingDays - 1))));

        RetentionSummary summary = retentionService.cleanup(retentionProperties.retentionDays(), trackingDays);

        assertThat(summary.deletedTrackingEvents()).isEqualTo(1);
        assertThat(trackingEventRepository.findByTrackingId(trackingId)).hasSize(1);
    }

    @Test
    void cleanupRejectsNonPositiveDays() {
        assertThatThrownBy(() -> retentionService.cleanup(0, 30))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retentionService.cleanup(30, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static NotificationQueueItem item(NotificationStatus status, Instant createdAt) {
        return new NotificationQueueItem(
                UUID.randomUUID(),
                null,
                null,
                "user-retention",
                "new_match",
                NotificationPriority.MEDIUM,
                List.of(NotificationChannel.EMAIL),
                "{}",
                status,
                status == NotificationStatus.PENDING ? 0 : 1,
                createdAt,
                null,
                null,
                null,
                null,
                0,
                0,
                createdAt,
                createdAt,
                status.isTerminal() ? createdAt : null);
    }

    private static TrackingEvent click(UUID trackingId, Instant occurredAt) {
        return new TrackingEvent(
                UUID.randomUUID(),
                trackingId,
                TrackingEventType.CLICK,
                "generic",
                "https://app.example.com/",
                "198.51.100.0",
                "Mail/1.0",
                null,
                occurredAt);
    }
}
