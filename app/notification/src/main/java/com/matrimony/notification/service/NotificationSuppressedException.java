/*
 * どこで: Notification サービス層
 * 何を: 受信者の配信設定により通知を受け付けなかったことを示す例外
 * なぜ: 入力不正 (IllegalArgumentException) と区別して HTTP/NATS それぞれで扱いを変えるため
 */
package com.matrimony.notification.service;

public class NotificationSuppressedException extends RuntimeException {

  public enum Reason {
    OPTED_OUT,
    RATE_LIMITED
  }

  private final Reason reason;

  public NotificationSuppressedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
