/*
 * どこで: Scheduler ドメインモデル
 * 何を: 実行可能なジョブ種別の閉じた集合
 * なぜ: 文字列ディスパッチをやめ、未知の種別を登録時点で弾くため
 */
package com.matrimony.notification.model;

import java.util.Locale;

public enum JobKind {
  NOTIFICATION_DISPATCH,
  NOTIFICATION_RETENTION,
  FAILED_NOTIFICATION_REQUEUE,
  EXECUTION_HISTORY_CLEANUP;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("job_type is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown job_type: " + value, ex);
    }
  }
}
