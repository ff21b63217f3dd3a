/*
 * どこで: Notification ドメインモデル
 * 何を: 受信者ごとの配信設定 (トリガー別チャネル、静穏時間帯、チャネル別レート制限)
 * なぜ: enqueue 時に受信者の意向を反映し、望まれない通知を queue に積まないため
 */
package com.matrimony.notification.model;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record NotificationPreferences(
    String recipientId,
    Map<String, List<NotificationChannel>> channelsByTrigger,
    QuietHours quietHours,
    Map<NotificationChannel, RateLimit> rateLimits) {

  public NotificationPreferences {
    if (recipientId == null || recipientId.isBlank()) {
      throw new IllegalArgumentException("recipient_id is required");
    }
    channelsByTrigger = channelsByTrigger == null ? Map.of() : Map.copyOf(channelsByTrigger);
    quietHours = quietHours == null ? QuietHours.disabled() : quietHours;
    rateLimits = rateLimits == null ? Map.of() : Map.copyOf(rateLimits);
  }

  /** 設定行が無い受信者の既定値。すべてのチャネルを許可し、制限を掛けない。 */
  public static NotificationPreferences unrestricted(String recipientId) {
    return new NotificationPreferences(recipientId, Map.of(), QuietHours.disabled(), Map.of());
  }

  /** トリガーに対して許可されたチャネル。未設定のトリガーは empty (制限なし)。 */
  public Optional<List<NotificationChannel>> allowedChannels(String trigger) {
    return Optional.ofNullable(channelsByTrigger.get(trigger));
  }

  public record QuietHours(
      boolean enabled, LocalTime start, LocalTime end, ZoneId timezone, Set<String> exceptions) {

    public QuietHours {
      timezone = timezone == null ? ZoneId.of("UTC") : timezone;
      exceptions = exceptions == null ? Set.of() : Set.copyOf(exceptions);
      if (enabled) {
        if (start == null || end == null) {
          throw new IllegalArgumentException("quiet hours start and end are required");
        }
        if (start.equals(end)) {
          throw new IllegalArgumentException("quiet hours start and end must differ");
        }
      }
    }

    public static QuietHours disabled() {
      return new QuietHours(false, null, null, ZoneId.of("UTC"), Set.of());
    }

    /** start > end の場合は日付をまたぐ時間帯 (例: 22:00-07:00) として扱う。 */
    public boolean contains(LocalTime time) {
      if (!enabled) {
        return false;
      }
      if (start.isBefore(end)) {
        return !time.isBefore(start) && time.isBefore(end);
      }
      return !time.isBefore(start) || time.isBefore(end);
    }

    /** at が時間帯に入っていれば、その時間帯が明ける時刻を返す。 */
    public Optional<Instant> deferUntil(Instant at) {
      final ZonedDateTime local = at.atZone(timezone);
      if (!contains(local.toLocalTime())) {
        return Optional.empty();
      }
      ZonedDateTime resume = local.toLocalDate().atTime(end).atZone(timezone);
      if (!resume.isAfter(local)) {
        resume = resume.plusDays(1);
      }
      return Optional.of(resume.toInstant());
    }
  }

  public record RateLimit(int max, RateLimitPeriod period) {

    public RateLimit {
      if (max <= 0) {
        throw new IllegalArgumentException("rate limit max must be positive");
      }
      if (period == null) {
        throw new IllegalArgumentException("rate limit period is required");
      }
    }
  }
}
