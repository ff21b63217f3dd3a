/*
 * どこで: Notification チャネル
 * 何を: アダプタ 1 回分の送信結果
 * なぜ: 例外ではなく値で結果を返し、配信パスの状態判定を 1 箇所に集めるため
 */
package com.matrimony.notification.channel;

public record ChannelSendResult(
    boolean success,
    String providerUsed,
    FailureKind failureKind,
    String error,
    int deliveredCount,
    int failedCount) {

  public static ChannelSendResult delivered(String providerUsed) {
    return new ChannelSendResult(true, providerUsed, null, null, 1, 0);
  }

  /** push の部分成功。1 件以上届いていれば成功として扱う。 */
  public static ChannelSendResult delivered(String providerUsed, int deliveredCount, int failedCount) {
    return new ChannelSendResult(true, providerUsed, null, null, deliveredCount, failedCount);
  }

  public static ChannelSendResult failed(FailureKind failureKind, String error) {
    return new ChannelSendResult(false, null, failureKind, error, 0, 0);
  }

  public static ChannelSendResult failed(FailureKind failureKind, String error, int failedCount) {
    return new ChannelSendResult(false, null, failureKind, error, 0, failedCount);
  }

  public boolean isTransientFailure() {
    return !success && failureKind == FailureKind.TRANSIENT;
  }
}
