/*
 * どこで: Scheduler 管理 API リクエスト DTO
 * 何を: 動的ジョブの作成/更新の入力
 * なぜ: interval と cron のどちらか一方だけを受け付け、登録要求へ変換するため
 */
package com.matrimony.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.job.JobRegistration;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.model.JobSchedule;
import com.matrimony.notification.model.RetryPolicy;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record JobDefinitionRequest(
    @NotBlank String name,
    @NotBlank String jobType,
    Long intervalSeconds,
    String cronExpression,
    String timezone,
    Boolean enabled,
    @NotNull @Min(1) @Max(86_400) Long timeoutSeconds,
    @Min(0) @Max(10) Integer maxRetries,
    @Min(1) @Max(86_400) Long retryDelaySeconds,
    Map<String, Object> parameters,
    String description,
    String createdBy) {

  private static final long DEFAULT_RETRY_DELAY_SECONDS = 300L;

  public JobRegistration toRegistration() {
    final boolean hasCron = cronExpression != null && !cronExpression.isBlank();
    if (hasCron == (intervalSeconds != null)) {
      throw new IllegalArgumentException("exactly one of interval_seconds or cron_expression is required");
    }
    final JobSchedule schedule =
        hasCron ? JobSchedule.cron(cronExpression, timezone) : JobSchedule.interval(intervalSeconds);
    return new JobRegistration(
        name,
        JobKind.fromValue(jobType),
        schedule,
        enabled == null || enabled,
        timeoutSeconds,
        new RetryPolicy(
            maxRetries == null ? 0 : maxRetries,
            retryDelaySeconds == null ? DEFAULT_RETRY_DELAY_SECONDS : retryDelaySeconds),
        parameters,
        description,
        createdBy);
  }
}
