/*
 * どこで: 保守系ジョブハンドラのユニットテスト
 * 何を: retention/requeue/実行履歴掃除が既定値とパラメータ上書きで正しく呼ばれることを検証する
 * なぜ: パラメータなしの静的ジョブでも設定値で動くことを担保するため
 */
package com.matrimony.notification.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.matrimony.notification.config.NotificationRetentionProperties;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.repository.JobExecutionRecordRepository;
import com.matrimony.notification.service.FailedNotificationRequeueService;
import com.matrimony.notification.service.NotificationRetentionService;
import com.matrimony.notification.service.RetentionSummary;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MaintenanceJobHandlersTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final NotificationRetentionProperties PROPERTIES =
      new NotificationRetentionProperties(30, 180, 30, 24, 100);

  @Mock private NotificationRetentionService retentionService;
  @Mock private FailedNotificationRequeueService requeueService;
  @Mock private JobExecutionRecordRepository recordRepository;

  @Test
  void retentionUsesConfiguredWindows() {
    when(retentionService.cleanup(30, 180)).thenReturn(new RetentionSummary(1, 10, 4, 6));

    final JobResult result =
        new NotificationRetentionJobHandler(retentionService, PROPERTIES).handle(context(Map.of()));

    assertThat(result.recordsAffected()).isEqualTo(20);
    assertThat(result.message()).contains("staleActive=1");
  }

  @Test
  void retentionParametersOverrideDefaults() {
    when(retentionService.cleanup(7, 14)).thenReturn(new RetentionSummary(0, 0, 0, 0));

    new NotificationRetentionJobHandler(retentionService, PROPERTIES)
        .handle(context(Map.of("retention_days", 7, "tracking_retention_days", 14)));
  }

  @Test
  void requeueUsesLookbackAndBatch() {
    when(requeueService.requeue(Duration.ofHours(6), 100)).thenReturn(3);

    final JobResult result =
        new FailedNotificationRequeueJobHandler(requeueService, PROPERTIES)
            .handle(context(Map.of("lookback_hours", 6)));

    assertThat(result.recordsAffected()).isEqualTo(3);
    assertThat(result.message()).isEqualTo("requeued=3");
  }

  @Test
  void historyCleanupDeletesOlderThanThreshold() {
    when(recordRepository.deleteOlderThan(NOW.minus(Duration.ofDays(30)))).thenReturn(42);

    final JobResult result = historyHandler().handle(context(Map.of()));

    assertThat(result.recordsProcessed()).isEqualTo(42);
  }

  @Test
  void historyCleanupRejectsNonPositiveRetention() {
    assertThatThrownBy(() -> historyHandler().handle(context(Map.of("retention_days", -1))))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(recordRepository);
  }

  private ExecutionHistoryCleanupJobHandler historyHandler() {
    return new ExecutionHistoryCleanupJobHandler(
        recordRepository, PROPERTIES, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static JobContext context(Map<String, Object> parameters) {
    return new JobContext(
        JobFixtures.intervalJob("maintenance", JobKind.NOTIFICATION_RETENTION, NOW),
        parameters,
        UUID.randomUUID(),
        1,
        JobExecutor.TRIGGERED_BY_SCHEDULER,
        NOW);
  }
}
