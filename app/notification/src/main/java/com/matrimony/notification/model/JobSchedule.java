/*
 * どこで: Scheduler ドメインモデル
 * 何を: interval/cron のスケジュールと次回実行時刻の計算
 * なぜ: mark_executed の計算を 1 箇所に閉じ込めるため
 */
package com.matrimony.notification.model;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.springframework.scheduling.support.CronExpression;

public record JobSchedule(
    ScheduleKind kind, Long intervalSeconds, String cronExpression, ZoneId timezone) {

  public JobSchedule {
    if (kind == null) {
      throw new IllegalArgumentException("schedule kind is required");
    }
    timezone = timezone == null ? ZoneId.of("UTC") : timezone;
    if (kind == ScheduleKind.INTERVAL) {
      if (intervalSeconds == null || intervalSeconds <= 0) {
        throw new IllegalArgumentException("interval_seconds must be positive");
      }
      cronExpression = null;
    } else {
      if (cronExpression == null || cronExpression.isBlank()) {
        throw new IllegalArgumentException("cron_expression is required");
      }
      cronExpression = cronExpression.trim();
      // 不正な式はここで IllegalArgumentException になる
      parseCron(cronExpression);
      intervalSeconds = null;
    }
  }

  public static JobSchedule interval(long intervalSeconds) {
    return new JobSchedule(ScheduleKind.INTERVAL, intervalSeconds, null, ZoneId.of("UTC"));
  }

  public static JobSchedule cron(String cronExpression, String timezone) {
    return new JobSchedule(ScheduleKind.CRON, null, cronExpression, parseZone(timezone));
  }

  public static ZoneId parseZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return ZoneId.of("UTC");
    }
    try {
      return ZoneId.of(timezone.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("unknown timezone: " + timezone, ex);
    }
  }

  /**
   * reference 実行後の次回時刻を返す。
   *
   * <p>INTERVAL は reference + interval、CRON は reference より厳密に後で式に一致する最初の時刻
   * (ジョブのタイムゾーンで評価)。
   */
  public Instant nextRunAfter(Instant reference) {
    if (kind == ScheduleKind.INTERVAL) {
      return reference.plusSeconds(intervalSeconds);
    }
    final ZonedDateTime start = reference.atZone(timezone);
    ZonedDateTime next = null;
    for (CronExpression expression : parseCron(cronExpression)) {
      final ZonedDateTime candidate = expression.next(start);
      if (candidate != null && (next == null || candidate.isBefore(next))) {
        next = candidate;
      }
    }
    if (next == null) {
      throw new IllegalStateException("cron expression never fires again: " + cronExpression);
    }
    return next.toInstant();
  }

  /** 登録直後の初回実行時刻。INTERVAL は次の tick で即時実行する。 */
  public Instant firstRunAt(Instant registeredAt) {
    return kind == ScheduleKind.INTERVAL ? registeredAt : nextRunAfter(registeredAt);
  }

  /**
   * crontab 形式で日 (day-of-month) と曜日 (day-of-week) が両方指定されている場合は、どちらかに一致すれば
   * 起動する。Spring の CronExpression は両方の一致を要求するため、日だけ・曜日だけの 2 式に分けて評価する。
   */
  static List<CronExpression> parseCron(String expression) {
    final String normalized = normalizeCron(expression);
    final String[] fields = expression.trim().split("\\s+");
    if (fields.length == 5 && isRestricted(fields[2]) && isRestricted(fields[4])) {
      final String[] parts = normalized.split("\\s+");
      final String dayOfMonthOnly = String.join(" ", parts[0], parts[1], parts[2], parts[3], parts[4], "*");
      final String dayOfWeekOnly = String.join(" ", parts[0], parts[1], parts[2], "*", parts[4], parts[5]);
      return List.of(CronExpression.parse(dayOfMonthOnly), CronExpression.parse(dayOfWeekOnly));
    }
    return List.of(CronExpression.parse(normalized));
  }

  private static boolean isRestricted(String field) {
    return !field.startsWith("*") && !field.equals("?");
  }

  // 5 フィールドの crontab 形式は秒 0 を補って Spring の 6 フィールド形式に揃える
  static String normalizeCron(String expression) {
    final String trimmed = expression.trim();
    if (trimmed.startsWith("@")) {
      return trimmed;
    }
    final String[] fields = trimmed.split("\\s+");
    return fields.length == 5 ? "0 " + trimmed : trimmed;
  }
}
