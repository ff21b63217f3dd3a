/*
 * どこで: Notification API リクエスト DTO
 * 何を: 通知依頼の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.matrimony.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record EnqueueNotificationRequest(
    UUID eventId,
    @NotBlank String recipientId,
    @NotBlank String trigger,
    @NotEmpty List<String> channels,
    String priority,
    Map<String, Object> templateData,
    Instant scheduledFor) {}
