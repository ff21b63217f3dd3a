/*
 * どこで: Scheduler ドメインモデル
 * 何を: job_execution_records の 1 行 (1 試行)
 * なぜ: 実行履歴の可視化と障害調査に使うため
 */
package com.matrimony.notification.model;

import java.time.Instant;
import java.util.UUID;

public record JobExecutionRecord(
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
    String executionHost) {}
