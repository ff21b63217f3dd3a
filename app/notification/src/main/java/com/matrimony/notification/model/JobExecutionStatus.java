/*
 * どこで: Scheduler ドメインモデル
 * 何を: ジョブ実行 1 試行の状態
 * なぜ: 実行履歴と job_definitions.last_status で同じ語彙を使うため
 */
package com.matrimony.notification.model;

public enum JobExecutionStatus {
  RUNNING,
  SUCCESS,
  FAILED,
  TIMEOUT
}
