/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ試行の結果件数/所要時間と tick 失敗回数を記録する
 * なぜ: タイムアウトや連続失敗をダッシュボードで検知するため
 */
package com.matrimony.notification.service;

import com.matrimony.notification.model.JobExecutionStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JobMetrics {

  private static final String METRIC_JOB_EXECUTIONS = "scheduler.job.executions";
  private static final String METRIC_JOB_DURATION = "scheduler.job.duration";
  private static final String METRIC_TICK_FAILURES = "scheduler.tick.failures";

  private final MeterRegistry meterRegistry;
  private final Counter tickFailures;

  public JobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.tickFailures =
        Counter.builder(METRIC_TICK_FAILURES)
            .description("Scheduler iterations that failed before running jobs")
            .register(meterRegistry);
  }

  public void recordAttempt(String jobName, JobExecutionStatus status, Duration elapsed) {
    // MeterRegistry 側で同一 id の Meter は再利用される
    Counter.builder(METRIC_JOB_EXECUTIONS)
        .description("Job attempts by final status")
        .tag("job", jobName)
        .tag("status", status.name())
        .register(meterRegistry)
        .increment();
    Timer.builder(METRIC_JOB_DURATION)
        .description("Job attempt wall time")
        .tag("job", jobName)
        .register(meterRegistry)
        .record(elapsed);
  }

  public void recordTickFailure() {
    tickFailures.increment();
  }
}
