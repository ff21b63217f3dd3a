package com.matrimony.notification.job;

/** ハンドラ 1 回分の成果。実行記録の records_processed/records_affected/message になる。 */
public record JobResult(long recordsProcessed, long recordsAffected, String message) {

  public static JobResult of(long recordsProcessed, long recordsAffected, String message) {
    return new JobResult(recordsProcessed, recordsAffected, message);
  }
}
