/*
 * どこで: Notification API モデル
 * 何を: デバッグ用通知一覧の要素
 * なぜ: 配信状態と試行回数、開封/クリック数を確認できるようにするため
 */
package com.matrimony.notification.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record は応答専用であり、防御的コピーを行わないため")
public record NotificationSummary(
    UUID notificationId,
    UUID eventId,
    UUID parentId,
    String trigger,
    NotificationPriority priority,
    List<NotificationChannel> channels,
    NotificationStatus status,
    int attempts,
    Instant scheduledFor,
    String lastError,
    int openCount,
    int clickCount,
    Instant createdAt,
    Instant completedAt,
    JsonNode templateData) {}
