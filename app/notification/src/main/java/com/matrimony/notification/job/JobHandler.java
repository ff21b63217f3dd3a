/*
 * どこで: Scheduler ジョブ実行
 * 何を: job kind ごとの処理本体の契約
 * なぜ: 実行器がタイムアウト/再試行/記録だけを担い、業務処理を知らずに済むようにするため
 */
package com.matrimony.notification.job;

import com.matrimony.notification.model.JobKind;

public interface JobHandler {

  JobKind kind();

  /**
   * 失敗は例外で表す。タイムアウト時はスレッドが割り込まれるので、長い処理は割り込みを尊重すること。
   */
  JobResult handle(JobContext context);
}
