/*
 * Where: Notification service layer
 * What: Applies retention to terminal queue rows, processed_events and tracking events
 * Why: Prevent unbounded growth while leaving anomalous active rows for an operator
 */
package com.matrimony.notification.service;

import com.matrimony.notification.repository.NotificationQueueRepository;
import com.matrimony.notification.repository.ProcessedEventRepository;
import com.matrimony.notification.repository.TrackingEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationQueueRepository queueRepository;
  private final ProcessedEventRepository processedEventRepository;
  private final TrackingEventRepository trackingEventRepository;
  private final Clock clock;

  public RetentionSummary cleanup(int retentionDays, int trackingRetentionDays) {
    if (retentionDays <= 0 || trackingRetentionDays <= 0) {
      throw new IllegalArgumentException("retention days must be positive");
    }
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(retentionDays));
    final Instant trackingThreshold = now.minus(Duration.ofDays(trackingRetentionDays));
    final int staleActiveCount = queueRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "notification retention found stale active records count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deletedNotifications = queueRepository.deleteTerminalOlderThan(threshold);
    final int deletedProcessedEvents = processedEventRepository.deleteOlderThan(threshold);
    final int deletedTrackingEvents = trackingEventRepository.deleteOlderThan(trackingThreshold);
    logger.info(
        "notification retention cleanup deleted notifications={} processedEvents={} trackingEvents={} threshold={} trackingThreshold={}",
        deletedNotifications,
        deletedProcessedEvents,
        deletedTrackingEvents,
        threshold,
        trackingThreshold);
    return new RetentionSummary(
        staleActiveCount, deletedNotifications, deletedProcessedEvents, deletedTrackingEvents);
  }
}
