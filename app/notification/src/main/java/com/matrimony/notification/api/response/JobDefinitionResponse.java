/*
 * どこで: Scheduler 管理 API レスポンス DTO
 * 何を: ジョブ定義と直近の実行状態
 * なぜ: 運用者が次回実行時刻と最終結果を一覧で確認できるようにするため
 */
package com.matrimony.notification.api.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobExecutionStatus;
import com.matrimony.notification.model.JobOrigin;
import com.matrimony.notification.model.ScheduleKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record は応答専用であり、防御的コピーを行わないため")
public record JobDefinitionResponse(
    String name,
    JobOrigin origin,
    String jobType,
    ScheduleKind scheduleKind,
    Long intervalSeconds,
    String cronExpression,
    String timezone,
    boolean enabled,
    long timeoutSeconds,
    int maxRetries,
    long retryDelaySeconds,
    JsonNode parameters,
    String description,
    String createdBy,
    Instant lastRunAt,
    Instant nextRunAt,
    JobExecutionStatus lastStatus,
    int version) {

  public static JobDefinitionResponse from(JobDefinition job, ObjectMapper objectMapper) {
    return new JobDefinitionResponse(
        job.name(),
        job.origin(),
        job.kind().value(),
        job.schedule().kind(),
        job.schedule().intervalSeconds(),
        job.schedule().cronExpression(),
        job.schedule().timezone().getId(),
        job.enabled(),
        job.timeoutSeconds(),
        job.retryPolicy().maxRetries(),
        job.retryPolicy().retryDelaySeconds(),
        readParameters(job.parametersJson(), objectMapper),
        job.description(),
        job.createdBy(),
        job.lastRunAt(),
        job.nextRunAt(),
        job.lastStatus(),
        job.version());
  }

  private static JsonNode readParameters(String json, ObjectMapper objectMapper) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored job parameters are not valid JSON", ex);
    }
  }
}
