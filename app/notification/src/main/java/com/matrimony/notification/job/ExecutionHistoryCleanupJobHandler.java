package com.matrimony.notification.job;

import com.matrimony.notification.config.NotificationRetentionProperties;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.repository.JobExecutionRecordRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** 古いジョブ実行記録を消す。RUNNING の行は残す。 */
@Component
@RequiredArgsConstructor
public class ExecutionHistoryCleanupJobHandler implements JobHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(ExecutionHistoryCleanupJobHandler.class);

  private final JobExecutionRecordRepository recordRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  @Override
  public JobKind kind() {
    return JobKind.EXECUTION_HISTORY_CLEANUP;
  }

  @Override
  public JobResult handle(JobContext context) {
    final int retentionDays =
        context.intParameter("retention_days", properties.executionHistoryDays());
    if (retentionDays <= 0) {
      throw new IllegalArgumentException("retention_days must be positive");
    }
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(retentionDays));
    final int deleted = recordRepository.deleteOlderThan(threshold);
    logger.info("job execution history cleanup deleted={} threshold={}", deleted, threshold);
    return JobResult.of(deleted, deleted, "deleted=" + deleted);
  }
}
