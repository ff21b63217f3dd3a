/*
 * どこで: Scheduler 起動処理
 * 何を: scheduler.static-jobs の定義を起動時に upsert する
 * なぜ: 配信/保持/再投入などの定常ジョブをコードのデプロイだけで揃えるため
 */
package com.matrimony.notification.job;

import com.matrimony.notification.config.SchedulerProperties;
import com.matrimony.notification.config.SchedulerProperties.StaticJob;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.model.JobSchedule;
import com.matrimony.notification.model.RetryPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StaticJobRegistrar implements ApplicationRunner {

  static final String CREATED_BY = "config";

  private final SchedulerProperties properties;
  private final JobRegistry registry;

  @Override
  public void run(ApplicationArguments args) {
    // 不正な定義は起動失敗にする
    for (StaticJob job : properties.staticJobs()) {
      registry.registerStatic(toRegistration(job));
    }
  }

  static JobRegistration toRegistration(StaticJob job) {
    final JobSchedule schedule;
    if (job.cron() != null && !job.cron().isBlank()) {
      if (job.intervalSeconds() != null) {
        throw new IllegalArgumentException(
            "static job " + job.name() + " must set either interval-seconds or cron");
      }
      schedule = JobSchedule.cron(job.cron(), job.timezone());
    } else {
      if (job.intervalSeconds() == null) {
        throw new IllegalArgumentException(
            "static job " + job.name() + " must set either interval-seconds or cron");
      }
      schedule = JobSchedule.interval(job.intervalSeconds());
    }
    return new JobRegistration(
        job.name(),
        JobKind.fromValue(job.kind()),
        schedule,
        job.enabled() == null || job.enabled(),
        job.timeoutSeconds(),
        new RetryPolicy(job.maxRetries(), job.retryDelaySeconds()),
        job.parameters(),
        job.description(),
        CREATED_BY);
  }
}
