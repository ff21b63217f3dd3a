package com.matrimony.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.JobExecutionRecord;
import com.matrimony.notification.model.JobExecutionStatus;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobExecutionResponse(
    UUID executionId,
    String jobName,
    int attempt,
    JobExecutionStatus status,
    String triggeredBy,
    Instant startedAt,
    Instant endedAt,
    long recordsProcessed,
    long recordsAffected,
    String message,
    String errorMessage,
    String executionHost) {

  public static JobExecutionResponse from(JobExecutionRecord record) {
    return new JobExecutionResponse(
        record.executionId(),
        record.jobName(),
        record.attempt(),
        record.status(),
        record.triggeredBy(),
        record.startedAt(),
        record.endedAt(),
        record.recordsProcessed(),
        record.recordsAffected(),
        record.message(),
        record.errorMessage(),
        record.executionHost());
  }
}
