/*
 * どこで: Notification ドメインモデル
 * 何を: notification_queue テーブルのスナップショット
 * なぜ: 配信処理・トラッキング・デバッグ API で共通化するため
 */
package com.matrimony.notification.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record NotificationQueueItem(
    UUID notificationId,
    UUID eventId,
    UUID parentId,
    String recipientId,
    String trigger,
    NotificationPriority priority,
    List<NotificationChannel> channels,
    String templateDataJson,
    NotificationStatus status,
    int attempts,
    Instant scheduledFor,
    String claimToken,
    Instant claimedAt,
    Instant leaseUntil,
    String lastError,
    int openCount,
    int clickCount,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt) {

  public NotificationQueueItem {
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public static NotificationQueueItem pending(
      UUID notificationId,
      UUID eventId,
      UUID parentId,
      String recipientId,
      String trigger,
      NotificationPriority priority,
      List<NotificationChannel> channels,
      String templateDataJson,
      Instant scheduledFor,
      Instant now) {
    return new NotificationQueueItem(
        notificationId,
        eventId,
        parentId,
        recipientId,
        trigger,
        priority,
        channels,
        templateDataJson,
        NotificationStatus.PENDING,
        0,
        scheduledFor,
        null,
        null,
        null,
        null,
        0,
        0,
        now,
        now,
        null);
  }
}
