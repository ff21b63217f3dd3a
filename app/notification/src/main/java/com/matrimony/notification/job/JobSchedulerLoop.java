/*
 * どこで: Scheduler
 * 何を: 1 tick 分の処理。期限到来ジョブを並行実行し、全て終わってから次回時刻を進める
 * なぜ: 定義の読み取り失敗時に backoff を入れ、DB 障害中に tick ごとのエラーを積み上げないため
 */
package com.matrimony.notification.job;

import com.google.common.annotations.VisibleForTesting;
import com.matrimony.notification.config.ExecutorConfig;
import com.matrimony.notification.config.SchedulerProperties;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobExecutionRecord;
import com.matrimony.notification.model.JobExecutionStatus;
import com.matrimony.notification.service.JobMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class JobSchedulerLoop {

  private static final Logger logger = LoggerFactory.getLogger(JobSchedulerLoop.class);

  private final JobRegistry registry;
  private final JobExecutor executor;
  private final JobMetrics metrics;
  private final SchedulerProperties properties;
  private final ExecutorService jobPool;
  private final Clock clock;
  private volatile Instant backoffUntil;

  public JobSchedulerLoop(
      JobRegistry registry,
      JobExecutor executor,
      JobMetrics metrics,
      SchedulerProperties properties,
      @Qualifier(ExecutorConfig.JOB_POOL) ExecutorService jobPool,
      Clock clock) {
    this.registry = registry;
    this.executor = executor;
    this.metrics = metrics;
    this.properties = properties;
    this.jobPool = jobPool;
    this.clock = clock;
  }

  /**
   * @return この tick で実行したジョブ数。backoff 中や読み取り失敗時は 0
   */
  public int tick() {
    final Instant now = Instant.now(clock);
    final Instant until = backoffUntil;
    if (until != null && now.isBefore(until)) {
      logger.debug("scheduler tick skipped during error backoff until={}", until);
      return 0;
    }
    final List<JobDefinition> due;
    try {
      due = registry.listDueJobs(now);
    } catch (RuntimeException ex) {
      backoffUntil = now.plus(properties.errorBackoff());
      metrics.recordTickFailure();
      logger.error("scheduler tick failed; backing off until={}", backoffUntil, ex);
      return 0;
    }
    backoffUntil = null;
    if (due.isEmpty()) {
      return 0;
    }

    final List<CompletableFuture<JobExecutionRecord>> futures = new ArrayList<>(due.size());
    for (JobDefinition job : due) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> executor.execute(job, JobExecutor.TRIGGERED_BY_SCHEDULER), jobPool));
    }
    for (int i = 0; i < due.size(); i++) {
      markExecuted(due.get(i), now, awaitStatus(due.get(i), futures.get(i)));
    }
    logger.info("scheduler tick ran jobs count={}", due.size());
    return due.size();
  }

  @VisibleForTesting
  Instant backoffUntil() {
    return backoffUntil;
  }

  private JobExecutionStatus awaitStatus(
      JobDefinition job, CompletableFuture<JobExecutionRecord> future) {
    try {
      final JobExecutionRecord record = future.join();
      return record == null ? JobExecutionStatus.FAILED : record.status();
    } catch (RuntimeException ex) {
      logger.warn("job execution could not complete name={}", job.name(), ex);
      return JobExecutionStatus.FAILED;
    }
  }

  private void markExecuted(JobDefinition job, Instant now, JobExecutionStatus status) {
    try {
      final Instant nextRunAt = registry.markExecuted(job, now, status);
      logger.debug("job next run scheduled name={} nextRunAt={}", job.name(), nextRunAt);
    } catch (RuntimeException ex) {
      // 次回時刻が進まないので次の tick で再実行される
      logger.warn("failed to mark job executed name={}", job.name(), ex);
    }
  }
}
