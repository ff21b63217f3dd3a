/*
 * どこで: Scheduler ジョブ実行
 * 何を: ハンドラをタイムアウト付きで実行し、失敗時は再試行して試行ごとに実行記録を残す
 * なぜ: ハンドラの失敗やハングがスケジューラ全体を止めないようにするため
 */
package com.matrimony.notification.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matrimony.common.HostNames;
import com.matrimony.notification.config.ExecutorConfig;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobExecutionRecord;
import com.matrimony.notification.model.JobExecutionStatus;
import com.matrimony.notification.repository.JobExecutionRecordRepository;
import com.matrimony.notification.service.JobMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class JobExecutor {

  public static final String TRIGGERED_BY_SCHEDULER = "scheduler";
  public static final String TRIGGERED_BY_MANUAL = "manual";

  private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);
  private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE =
      new TypeReference<>() {};
  private static final int ERROR_MESSAGE_MAX_LENGTH = 1000;
  private static final String MDC_JOB_NAME = "job_name";
  private static final String MDC_EXECUTION_ID = "execution_id";

  private final JobHandlerRegistry handlerRegistry;
  private final JobExecutionRecordRepository recordRepository;
  private final JobMetrics metrics;
  private final ObjectMapper objectMapper;
  private final ExecutorService handlerPool;
  private final RetrySleeper sleeper;
  private final Clock clock;
  private final String executionHost;

  public JobExecutor(
      JobHandlerRegistry handlerRegistry,
      JobExecutionRecordRepository recordRepository,
      JobMetrics metrics,
      ObjectMapper objectMapper,
      @Qualifier(ExecutorConfig.HANDLER_POOL) ExecutorService handlerPool,
      RetrySleeper sleeper,
      Clock clock) {
    this.handlerRegistry = handlerRegistry;
    this.recordRepository = recordRepository;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.handlerPool = handlerPool;
    this.sleeper = sleeper;
    this.clock = clock;
    this.executionHost = HostNames.resolve();
  }

  /**
   * ジョブを最大 max_retries + 1 回試行し、最後の試行の記録を返す。例外は投げない。
   *
   * <p>FAILED は retry_delay 後に再試行する。TIMEOUT は再試行しない。
   */
  public JobExecutionRecord execute(JobDefinition job, String triggeredBy) {
    final int maxAttempts = job.retryPolicy().maxAttempts();
    JobExecutionRecord last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      last = runAttempt(job, attempt, triggeredBy);
      if (last.status() != JobExecutionStatus.FAILED || attempt == maxAttempts) {
        break;
      }
      final Duration delay = Duration.ofSeconds(job.retryPolicy().retryDelaySeconds());
      logger.warn(
          "job attempt failed; retrying name={} attempt={} maxAttempts={} delay={}",
          job.name(),
          attempt,
          maxAttempts,
          delay);
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.warn("job retry interrupted name={} attempt={}", job.name(), attempt);
        break;
      }
    }
    return last;
  }

  private JobExecutionRecord runAttempt(JobDefinition job, int attempt, String triggeredBy) {
    final UUID executionId = UUID.randomUUID();
    final Instant startedAt = Instant.now(clock);
    MDC.put(MDC_JOB_NAME, job.name());
    MDC.put(MDC_EXECUTION_ID, executionId.toString());
    try {
      final JobExecutionRecord running =
          new JobExecutionRecord(
              executionId,
              job.name(),
              attempt,
              JobExecutionStatus.RUNNING,
              triggeredBy,
              startedAt,
              null,
              0,
              0,
              null,
              null,
              executionHost);
      persistRunning(running);
      logger.info(
          "job attempt started name={} kind={} attempt={} triggeredBy={}",
          job.name(),
          job.kind(),
          attempt,
          triggeredBy);

      final JobExecutionRecord finished = invoke(job, running);
      persistFinished(finished);
      final Duration elapsed = Duration.between(startedAt, finished.endedAt());
      metrics.recordAttempt(job.name(), finished.status(), elapsed);
      if (finished.status() == JobExecutionStatus.SUCCESS) {
        logger.info(
            "job attempt succeeded name={} attempt={} processed={} affected={} elapsedMs={}",
            job.name(),
            attempt,
            finished.recordsProcessed(),
            finished.recordsAffected(),
            elapsed.toMillis());
      } else {
        logger.warn(
            "job attempt ended name={} attempt={} status={} error={} elapsedMs={}",
            job.name(),
            attempt,
            finished.status(),
            finished.errorMessage(),
            elapsed.toMillis());
      }
      return finished;
    } finally {
      MDC.remove(MDC_JOB_NAME);
      MDC.remove(MDC_EXECUTION_ID);
    }
  }

  private JobExecutionRecord invoke(JobDefinition job, JobExecutionRecord running) {
    final JobContext context;
    final JobHandler handler;
    try {
      handler = handlerRegistry.handlerFor(job.kind());
      context =
          new JobContext(
              job,
              parseParameters(job),
              running.executionId(),
              running.attempt(),
              running.triggeredBy(),
              running.startedAt());
    } catch (RuntimeException ex) {
      return finish(running, JobExecutionStatus.FAILED, null, describe(ex));
    }

    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final Future<JobResult> future =
        handlerPool.submit(
            () -> {
              if (mdc != null) {
                MDC.setContextMap(mdc);
              }
              try {
                return handler.handle(context);
              } finally {
                MDC.clear();
              }
            });
    try {
      final JobResult result = future.get(job.timeoutSeconds(), TimeUnit.SECONDS);
      return finish(running, JobExecutionStatus.SUCCESS, result, null);
    } catch (TimeoutException ex) {
      // 割り込みは協調的なので、止まらないハンドラはバックグラウンドで走り続けうる
      future.cancel(true);
      return finish(
          running,
          JobExecutionStatus.TIMEOUT,
          null,
          "timed out after " + job.timeoutSeconds() + "s");
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.warn("job handler threw name={} attempt={}", job.name(), running.attempt(), cause);
      return finish(running, JobExecutionStatus.FAILED, null, describe(cause));
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return finish(running, JobExecutionStatus.FAILED, null, "interrupted");
    }
  }

  private JobExecutionRecord finish(
      JobExecutionRecord running, JobExecutionStatus status, JobResult result, String error) {
    return new JobExecutionRecord(
        running.executionId(),
        running.jobName(),
        running.attempt(),
        status,
        running.triggeredBy(),
        running.startedAt(),
        Instant.now(clock),
        result == null ? 0 : result.recordsProcessed(),
        result == null ? 0 : result.recordsAffected(),
        result == null ? null : result.message(),
        truncate(error),
        running.executionHost());
  }

  private Map<String, Object> parseParameters(JobDefinition job) {
    if (job.parametersJson() == null || job.parametersJson().isBlank()) {
      return Map.of();
    }
    try {
      final Map<String, Object> parameters =
          objectMapper.readValue(job.parametersJson(), PARAMETERS_TYPE);
      return parameters == null ? Map.of() : parameters;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid job parameters", ex);
    }
  }

  // 記録の保存失敗で実行自体は止めない
  private void persistRunning(JobExecutionRecord record) {
    try {
      recordRepository.insertRunning(record);
    } catch (RuntimeException ex) {
      logger.warn("failed to persist running job record name={}", record.jobName(), ex);
    }
  }

  private void persistFinished(JobExecutionRecord record) {
    try {
      recordRepository.finish(record);
    } catch (RuntimeException ex) {
      logger.warn(
          "failed to persist finished job record name={} status={}",
          record.jobName(),
          record.status(),
          ex);
    }
  }

  private static String describe(Throwable ex) {
    final String message = ex.getMessage();
    return message == null ? ex.getClass().getSimpleName() : ex.getClass().getSimpleName() + ": " + message;
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= ERROR_MESSAGE_MAX_LENGTH) {
      return message;
    }
    return message.substring(0, ERROR_MESSAGE_MAX_LENGTH);
  }
}
