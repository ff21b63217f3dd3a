/*
 * どこで: Notification サービス層
 * 何を: 1 回の dispatch pass の集計
 * なぜ: ジョブ実行記録の records_processed/records_affected に載せるため
 */
package com.matrimony.notification.service;

public record DispatchSummary(
    int claimed, int sent, int failed, int skipped, int retried, int poisoned, int lost) {

  public static DispatchSummary empty() {
    return new DispatchSummary(0, 0, 0, 0, 0, 0, 0);
  }

  /** 終端状態にした件数と再試行へ戻した件数の合計。 */
  public int affected() {
    return sent + failed + skipped + retried + poisoned;
  }
}
