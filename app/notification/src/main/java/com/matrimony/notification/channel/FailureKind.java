/*
 * どこで: Notification チャネル
 * 何を: 送信失敗が再試行で回復しうるかの区別
 * なぜ: 配信パスが release (再試行) と FAILED 確定を選ぶ根拠にするため
 */
package com.matrimony.notification.channel;

public enum FailureKind {
  TRANSIENT,
  PERMANENT
}
