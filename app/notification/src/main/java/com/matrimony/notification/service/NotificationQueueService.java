/*
 * どこで: Notification サービス層
 * 何を: 通知依頼を検証して PENDING の queue item として登録する
 * なぜ: 依頼元 (プロフィール/メッセージ/マッチング) に配信の仕組みを意識させないため
 */
package com.matrimony.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueService.class);

  private final NotificationQueueRepository queueRepository;
  private final NotificationPreferenceService preferenceService;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public UUID enqueue(EnqueueNotificationCommand command) {
    if (isBlank(command.recipientId())) {
      throw new IllegalArgumentException("recipient_id is required");
    }
    if (isBlank(command.trigger())) {
      throw new IllegalArgumentException("trigger is required");
    }
    // 同じチャネルの重複指定は 1 つにまとめる (順序は維持)
    final List<NotificationChannel> channels =
        new ArrayList<>(new LinkedHashSet<>(command.channels()));
    if (channels.isEmpty()) {
      throw new IllegalArgumentException("at least one channel is required");
    }
    final Instant now = Instant.now(clock);
    final String recipientId = command.recipientId().trim();
    final String trigger = command.trigger().trim();
    final NotificationPriority priority =
        command.priority() == null ? NotificationPriority.MEDIUM : command.priority();
    final DeliveryPlan plan =
        preferenceService.plan(recipientId, trigger, channels, priority, command.scheduledFor());
    final NotificationQueueItem item =
        NotificationQueueItem.pending(
            UUID.randomUUID(),
            command.eventId(),
            null,
            recipientId,
            trigger,
            priority,
            plan.channels(),
            serialize(command),
            plan.scheduledFor(),
            now);
    queueRepository.insert(item);
    logger.info(
        "notification enqueued id={} trigger={} recipientId={} channels={} priority={} scheduledFor={}",
        item.notificationId(),
        item.trigger(),
        item.recipientId(),
        plan.channels(),
        item.priority(),
        item.scheduledFor());
    return item.notificationId();
  }

  private String serialize(EnqueueNotificationCommand command) {
    try {
      return objectMapper.writeValueAsString(command.templateData());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("template_data is not serializable", ex);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
