package com.matrimony.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPreferences;
import com.matrimony.notification.model.NotificationPreferences.QuietHours;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record は応答専用であり、防御的コピーを行わないため")
public record NotificationPreferencesResponse(
    String recipientId,
    Map<String, List<String>> channels,
    QuietHoursResponse quietHours,
    Map<String, RateLimitResponse> rateLimits) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record QuietHoursResponse(
      boolean enabled, String start, String end, String timezone, List<String> exceptions) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RateLimitResponse(int max, String period) {}

  public static NotificationPreferencesResponse from(NotificationPreferences preferences) {
    final Map<String, List<String>> channels = new TreeMap<>();
    preferences
        .channelsByTrigger()
        .forEach(
            (trigger, values) ->
                channels.put(trigger, values.stream().map(NotificationChannel::value).toList()));
    final Map<String, RateLimitResponse> rateLimits = new TreeMap<>();
    preferences
        .rateLimits()
        .forEach(
            (channel, limit) ->
                rateLimits.put(
                    channel.value(),
                    new RateLimitResponse(limit.max(), limit.period().name().toLowerCase(Locale.ROOT))));
    final QuietHours quiet = preferences.quietHours();
    return new NotificationPreferencesResponse(
        preferences.recipientId(),
        channels,
        new QuietHoursResponse(
            quiet.enabled(),
            quiet.start() == null ? null : quiet.start().toString(),
            quiet.end() == null ? null : quiet.end().toString(),
            quiet.timezone().getId(),
            quiet.exceptions().stream().sorted().toList()),
        rateLimits);
  }
}
