package com.matrimony.notification.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class JobScheduleTest {

  private static final Instant NOW = Instant.parse("2026-03-10T10:15:30Z");

  @Test
  void intervalNextRunIsLastRunPlusInterval() {
    final JobSchedule schedule = JobSchedule.interval(60);

    assertThat(schedule.nextRunAfter(NOW)).isEqualTo(NOW.plusSeconds(60));
    assertThat(schedule.firstRunAt(NOW)).isEqualTo(NOW);
  }

  @Test
  void cronNextRunIsStrictlyAfterReference() {
    final JobSchedule schedule = JobSchedule.cron("*/15 * * * *", "UTC");

    assertThat(schedule.nextRunAfter(NOW)).isEqualTo(Instant.parse("2026-03-10T10:30:00Z"));
    // ちょうど一致する時刻からは次の一致へ進む
    assertThat(schedule.nextRunAfter(Instant.parse("2026-03-10T10:30:00Z")))
        .isEqualTo(Instant.parse("2026-03-10T10:45:00Z"));
  }

  @Test
  void cronIsEvaluatedInJobTimezone() {
    final JobSchedule schedule = JobSchedule.cron("0 9 * * *", "Asia/Kolkata");

    // 09:00 IST = 03:30 UTC
    assertThat(schedule.nextRunAfter(NOW)).isEqualTo(Instant.parse("2026-03-11T03:30:00Z"));
    assertThat(schedule.timezone()).isEqualTo(ZoneId.of("Asia/Kolkata"));
  }

  @Test
  void cronFirstRunIsFirstMatchAfterRegistration() {
    final JobSchedule schedule = JobSchedule.cron("0 0 * * * *", "UTC");

    assertThat(schedule.firstRunAt(NOW)).isEqualTo(Instant.parse("2026-03-10T11:00:00Z"));
  }

  @Test
  void acceptsMacroAndSixFieldExpressions() {
    assertThat(JobSchedule.cron("@daily", "UTC").nextRunAfter(NOW))
        .isEqualTo(Instant.parse("2026-03-11T00:00:00Z"));
    assertThat(JobSchedule.cron("45 15 10 * * *", "UTC").nextRunAfter(NOW))
        .isEqualTo(Instant.parse("2026-03-10T10:15:45Z"));
    assertThat(JobSchedule.normalizeCron("0 3 * * *")).isEqualTo("0 0 3 * * *");
  }

  @Test
  void restrictedDayOfMonthAndDayOfWeekMatchEither() {
    final JobSchedule schedule = JobSchedule.cron("0 9 1 * 1", "UTC");

    // 2026-01-05 は月曜日
    assertThat(schedule.nextRunAfter(Instant.parse("2026-01-02T00:00:00Z")))
        .isEqualTo(Instant.parse("2026-01-05T09:00:00Z"));
    // 2026-02-01 は日曜日だが 1 日なので一致する
    assertThat(schedule.nextRunAfter(Instant.parse("2026-01-31T00:00:00Z")))
        .isEqualTo(Instant.parse("2026-02-01T09:00:00Z"));
  }

  @Test
  void wildcardDayOfMonthKeepsDayOfWeekOnly() {
    final JobSchedule schedule = JobSchedule.cron("0 9 * * 1", "UTC");

    assertThat(schedule.nextRunAfter(Instant.parse("2026-01-31T00:00:00Z")))
        .isEqualTo(Instant.parse("2026-02-02T09:00:00Z"));
  }

  @Test
  void rejectsInvalidSchedules() {
    assertThatThrownBy(() -> JobSchedule.interval(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> JobSchedule.cron("not a cron", "UTC"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> JobSchedule.cron("0 3 * * *", "Mars/Olympus"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unknown timezone");
  }
}
