/*
 * どこで: Notification サービス層
 * 何を: NATS で受けた通知依頼を冪等に enqueue する
 * なぜ: at-least-once 配信で同じ依頼を二重に送らないため
 */
package com.matrimony.notification.service;

import com.matrimony.common.event.NotificationRequestedEvent;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationRequestHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRequestHandler.class);

  private final ProcessedEventRepository processedEventRepository;
  private final NotificationQueueService queueService;
  private final Clock clock;

  /**
   * @return 新規に enqueue した場合 true、処理済みの event_id または配信設定で抑止した場合 false
   */
  @Transactional
  public boolean handle(NotificationRequestedEvent event) {
    final UUID eventId = parseEventId(event.eventId());
    final EnqueueNotificationCommand command = toCommand(eventId, event);
    // processed_events に先行登録して重複処理を抑止する
    if (!processedEventRepository.insertIfAbsent(eventId, Instant.now(clock))) {
      logger.info("duplicate notification request ignored eventId={}", eventId);
      return false;
    }
    try {
      queueService.enqueue(command);
    } catch (NotificationSuppressedException ex) {
      // 抑止も処理済みとして記録し、再配信させない
      logger.info(
          "notification request suppressed eventId={} reason={} message={}",
          eventId,
          ex.reason(),
          ex.getMessage());
      return false;
    } catch (IllegalArgumentException ex) {
      throw new NotificationEventPermanentException("invalid notification request", ex);
    }
    return true;
  }

  private EnqueueNotificationCommand toCommand(UUID eventId, NotificationRequestedEvent event) {
    try {
      final List<NotificationChannel> channels =
          event.channels() == null
              ? List.of()
              : event.channels().stream().map(NotificationChannel::fromValue).toList();
      return new EnqueueNotificationCommand(
          eventId,
          event.recipientId(),
          event.trigger(),
          channels,
          NotificationPriority.fromValue(event.priority()),
          event.templateData(),
          parseInstant(event.scheduledFor()));
    } catch (RuntimeException ex) {
      // 値の形式不正は再配信しても回復しない
      throw new NotificationEventPermanentException("invalid notification request fields", ex);
    }
  }

  private UUID parseEventId(String value) {
    try {
      return UUID.fromString(value);
    } catch (RuntimeException ex) {
      throw new NotificationEventPermanentException("invalid notification event_id", ex);
    }
  }

  private static Instant parseInstant(String value) {
    return value == null || value.isBlank() ? null : Instant.parse(value);
  }
}
