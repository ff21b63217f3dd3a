/*
 * どこで: Tracking 設定
 * 何を: トラッキング URL のベース/開封ピクセル付与/記録スレッド数を保持する
 * なぜ: 環境ごとに公開 URL が異なるため
 */
package com.matrimony.notification.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.tracking")
@Validated
public record NotificationTrackingProperties(
    @NotBlank String baseUrl, boolean appendPixel, @Positive int executorPoolSize) {}
