/*
 * どこで: Scheduler ジョブ登録
 * 何を: 静的/動的ジョブの登録・更新要求
 * なぜ: 設定ファイルと管理 API の入力を同じ検証に通すため
 */
package com.matrimony.notification.job;

import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.model.JobSchedule;
import com.matrimony.notification.model.RetryPolicy;
import java.util.Map;

public record JobRegistration(
    String name,
    JobKind kind,
    JobSchedule schedule,
    boolean enabled,
    long timeoutSeconds,
    RetryPolicy retryPolicy,
    Map<String, Object> parameters,
    String description,
    String createdBy) {

  public static final long MAX_TIMEOUT_SECONDS = 86_400L;

  public JobRegistration {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("job name is required");
    }
    name = name.trim();
    if (kind == null) {
      throw new IllegalArgumentException("job_type is required");
    }
    if (schedule == null) {
      throw new IllegalArgumentException("schedule is required");
    }
    if (timeoutSeconds <= 0 || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
      throw new IllegalArgumentException(
          "timeout_seconds must be between 1 and " + MAX_TIMEOUT_SECONDS);
    }
    retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
    parameters = parameters == null ? Map.of() : parameters;
  }
}
