/*
 * どこで: Notification ドメインモデル
 * 何を: 通知キュー項目の状態を表す列挙
 * なぜ: DB と処理ロジックの状態を一致させるため
 */
package com.matrimony.notification.model;

public enum NotificationStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED,
  SKIPPED;

  public boolean isTerminal() {
    return this == SENT || this == FAILED || this == SKIPPED;
  }
}
