/*
 * どこで: Notification ドメインモデル
 * 何を: trigger/channel ごとの件名・本文テンプレート
 * なぜ: 配信時に読み取り専用で参照するため
 */
package com.matrimony.notification.model;

import java.time.Instant;

public record NotificationTemplate(
    String templateId,
    String trigger,
    NotificationChannel channel,
    String subject,
    String body,
    Integer maxLength,
    boolean enabled,
    int version,
    Instant updatedAt) {}
