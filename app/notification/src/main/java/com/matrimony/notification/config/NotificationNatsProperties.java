/*
 * どこで: Notification アプリの設定バインド
 * 何を: 通知依頼の JetStream 購読設定 (subject/stream/durable/duplicate-window/ack-wait/max-deliver)
 * なぜ: 受信トピックと再配信制御の窓を環境で調整し、起動時に妥当性を検証するため
 */
package com.matrimony.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats")
@Validated
public record NotificationNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "notification.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositive(duplicateWindow);
  }

  @AssertTrue(message = "notification.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // 0 以下だと ack 前に再配信が始まる
    return isPositive(ackWait);
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
