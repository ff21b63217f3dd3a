/*
 * どこで: Notification ドメインモデル
 * 何を: レート制限の集計期間
 * なぜ: notification_log を数える起点を期間ごとに決めるため
 */
package com.matrimony.notification.model;

import java.time.Duration;
import java.util.Locale;

public enum RateLimitPeriod {
  HOURLY(Duration.ofHours(1)),
  DAILY(Duration.ofDays(1)),
  WEEKLY(Duration.ofDays(7));

  private final Duration window;

  RateLimitPeriod(Duration window) {
    this.window = window;
  }

  public Duration window() {
    return window;
  }

  public static RateLimitPeriod fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("rate limit period is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown rate limit period: " + value, ex);
    }
  }
}
