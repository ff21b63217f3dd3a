/*
 * どこで: Scheduler ドメインモデル
 * 何を: job_definitions テーブルのスナップショット
 * なぜ: 静的/動的ジョブを同じ形で Scheduler と Executor に渡すため
 */
package com.matrimony.notification.model;

import java.time.Instant;

public record JobDefinition(
    String name,
    JobOrigin origin,
    JobKind kind,
    JobSchedule schedule,
    boolean enabled,
    long timeoutSeconds,
    RetryPolicy retryPolicy,
    String parametersJson,
    String description,
    String createdBy,
    Instant lastRunAt,
    Instant nextRunAt,
    JobExecutionStatus lastStatus,
    Instant createdAt,
    Instant updatedAt,
    int version) {

  public boolean isDue(Instant now) {
    return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
  }
}
