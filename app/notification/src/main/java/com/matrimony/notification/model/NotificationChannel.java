/*
 * どこで: Notification ドメインモデル
 * 何を: 配信チャネル(email/sms/push)を表す
 * なぜ: テンプレート解決とアダプタ選択のキーを型で固定するため
 */
package com.matrimony.notification.model;

import java.util.Locale;

public enum NotificationChannel {
  EMAIL,
  SMS,
  PUSH;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static NotificationChannel fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("channel is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown channel: " + value, ex);
    }
  }
}
