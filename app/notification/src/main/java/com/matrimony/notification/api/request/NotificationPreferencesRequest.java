/*
 * どこで: Notification API リクエスト DTO
 * 何を: 受信者の配信設定の更新内容
 * なぜ: 文字列のチャネル名・時刻・タイムゾーンをドメイン型に変換する場所を 1 つにするため
 */
package com.matrimony.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPreferences;
import com.matrimony.notification.model.NotificationPreferences.QuietHours;
import com.matrimony.notification.model.NotificationPreferences.RateLimit;
import com.matrimony.notification.model.RateLimitPeriod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPreferencesRequest(
    Map<String, List<String>> channels,
    @Valid QuietHoursRequest quietHours,
    Map<String, @Valid RateLimitRequest> rateLimits) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record QuietHoursRequest(
      boolean enabled, String start, String end, String timezone, List<String> exceptions) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RateLimitRequest(@Positive int max, @NotBlank String period) {}

  public NotificationPreferences toPreferences(String recipientId) {
    final Map<String, List<NotificationChannel>> channelsByTrigger = new LinkedHashMap<>();
    if (channels != null) {
      channels.forEach(
          (trigger, values) ->
              channelsByTrigger.put(
                  trigger,
                  values == null
                      ? List.of()
                      : values.stream().map(NotificationChannel::fromValue).distinct().toList()));
    }
    final Map<NotificationChannel, RateLimit> limits = new LinkedHashMap<>();
    if (rateLimits != null) {
      rateLimits.forEach(
          (channel, limit) ->
              limits.put(
                  NotificationChannel.fromValue(channel),
                  new RateLimit(limit.max(), RateLimitPeriod.fromValue(limit.period()))));
    }
    return new NotificationPreferences(recipientId, channelsByTrigger, toQuietHours(), limits);
  }

  private QuietHours toQuietHours() {
    if (quietHours == null) {
      return QuietHours.disabled();
    }
    try {
      return new QuietHours(
          quietHours.enabled(),
          quietHours.start() == null ? null : LocalTime.parse(quietHours.start()),
          quietHours.end() == null ? null : LocalTime.parse(quietHours.end()),
          quietHours.timezone() == null ? null : ZoneId.of(quietHours.timezone()),
          quietHours.exceptions() == null ? Set.of() : Set.copyOf(quietHours.exceptions()));
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("quiet_hours has an invalid time or timezone", ex);
    }
  }
}
