/*
 * どこで: Notification ドメインモデル
 * 何を: 通知の優先度と取り出し順の序列を表す
 * なぜ: claim SQL の ORDER BY と API 入力で同じ序列を使うため
 */
package com.matrimony.notification.model;

import java.util.Locale;

public enum NotificationPriority {
  LOW(0),
  MEDIUM(1),
  HIGH(2),
  CRITICAL(3);

  private final int rank;

  NotificationPriority(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }

  public static NotificationPriority fromValue(String value) {
    if (value == null || value.isBlank()) {
      return MEDIUM;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown priority: " + value, ex);
    }
  }
}
