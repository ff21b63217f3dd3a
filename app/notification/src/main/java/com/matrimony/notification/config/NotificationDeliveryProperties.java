/*
 * どこで: Notification アプリの設定バインド
 * 何を: 配信パスの batch/リトライ/lease/並列度設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.matrimony.notification.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    @Positive int batchSize,
    @Positive int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    @Positive int errorMessageMaxLength,
    Duration lease,
    @Positive int parallelism,
    @Positive int channelParallelism,
    FailureInjection failureInjection) {

  public NotificationDeliveryProperties {
    failureInjection = failureInjection == null ? new FailureInjection(false, null) : failureInjection;
  }

  /** ci/test プロファイル限定の失敗注入。recipient_id の接頭辞で対象を選ぶ。 */
  public record FailureInjection(boolean enabled, String recipientIdPrefix) {}
}
