/*
 * どこで: Notification ドメインモデル
 * 何を: チャネル単位の配信結果 (notification_log) を表す
 * なぜ: キュー保持期間と独立して監査/分析に残すため
 */
package com.matrimony.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationLogEntry(
    UUID logId,
    UUID notificationId,
    String recipientId,
    String trigger,
    NotificationChannel channel,
    NotificationPriority priority,
    NotificationStatus status,
    String providerUsed,
    String subject,
    String preview,
    int deliveredCount,
    int failedCount,
    String errorMessage,
    Instant createdAt) {}
