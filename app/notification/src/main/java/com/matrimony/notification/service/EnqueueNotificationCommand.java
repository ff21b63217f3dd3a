/*
 * どこで: Notification サービス層
 * 何を: 通知キューへの投入要求
 * なぜ: HTTP と NATS の 2 つの入口から同じ検証を通すため
 */
package com.matrimony.notification.service;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record EnqueueNotificationCommand(
    UUID eventId,
    String recipientId,
    String trigger,
    List<NotificationChannel> channels,
    NotificationPriority priority,
    Map<String, Object> templateData,
    Instant scheduledFor) {

  public EnqueueNotificationCommand {
    channels = channels == null ? List.of() : List.copyOf(channels);
    templateData = templateData == null ? Map.of() : templateData;
  }
}
