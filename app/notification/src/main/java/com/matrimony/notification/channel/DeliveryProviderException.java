/*
 * どこで: Notification チャネル
 * 何を: provider 呼び出し失敗を理由付きで表現する
 * なぜ: アダプタが一時失敗/恒久失敗/無効トークンを一貫して判定するため
 */
package com.matrimony.notification.channel;

public class DeliveryProviderException extends RuntimeException {

  public enum Reason {
    TIMEOUT(true),
    RATE_LIMITED(true),
    UNAVAILABLE(true),
    AUTH(false),
    INVALID_RECIPIENT(false),
    REJECTED(false);

    private final boolean transientFailure;

    Reason(boolean transientFailure) {
      this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
      return transientFailure;
    }
  }

  private final Reason reason;

  public DeliveryProviderException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DeliveryProviderException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isTransient() {
    return reason.isTransient();
  }
}
