/*
 * どこで: Notification データアクセス
 * 何を: notification_preferences の読み書き
 * なぜ: トリガー別チャネル・静穏時間帯・レート制限を受信者単位で保持するため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPreferences;
import com.matrimony.notification.model.NotificationPreferences.QuietHours;
import com.matrimony.notification.model.NotificationPreferences.RateLimit;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationPreferenceRepository {

  private static final TypeReference<Map<String, List<NotificationChannel>>> CHANNELS_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<Map<NotificationChannel, RateLimit>> RATE_LIMITS_TYPE =
      new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<NotificationPreferences> findByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT recipient_id, channels_json::text AS channels_json, quiet_hours_enabled,
               quiet_hours_start, quiet_hours_end, quiet_hours_timezone, quiet_hours_exceptions,
               rate_limits_json::text AS rate_limits_json
        FROM notification_preferences
        WHERE recipient_id = :recipientId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("recipientId", recipientId), this::mapRow)
        .stream()
        .findFirst();
  }

  public void upsert(NotificationPreferences preferences, Instant now) {
    final String sql =
        """
        INSERT INTO notification_preferences (
          recipient_id, channels_json, quiet_hours_enabled, quiet_hours_start, quiet_hours_end,
          quiet_hours_timezone, quiet_hours_exceptions, rate_limits_json, updated_at
        ) VALUES (
          :recipientId, :channelsJson::jsonb, :quietEnabled, :quietStart, :quietEnd,
          :quietTimezone, :quietExceptions, :rateLimitsJson::jsonb, :now
        )
        ON CONFLICT (recipient_id) DO UPDATE
        SET channels_json = EXCLUDED.channels_json,
            quiet_hours_enabled = EXCLUDED.quiet_hours_enabled,
            quiet_hours_start = EXCLUDED.quiet_hours_start,
            quiet_hours_end = EXCLUDED.quiet_hours_end,
            quiet_hours_timezone = EXCLUDED.quiet_hours_timezone,
            quiet_hours_exceptions = EXCLUDED.quiet_hours_exceptions,
            rate_limits_json = EXCLUDED.rate_limits_json,
            updated_at = EXCLUDED.updated_at
        """;
    final QuietHours quietHours = preferences.quietHours();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", preferences.recipientId())
            .addValue("channelsJson", writeJson(preferences.channelsByTrigger()))
            .addValue("quietEnabled", quietHours.enabled())
            .addValue("quietStart", quietHours.start() == null ? null : quietHours.start().toString())
            .addValue("quietEnd", quietHours.end() == null ? null : quietHours.end().toString())
            .addValue("quietTimezone", quietHours.timezone().getId())
            .addValue("quietExceptions", String.join(",", quietHours.exceptions()))
            .addValue("rateLimitsJson", writeJson(preferences.rateLimits()))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  private NotificationPreferences mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String start = rs.getString("quiet_hours_start");
    final String end = rs.getString("quiet_hours_end");
    final QuietHours quietHours =
        new QuietHours(
            rs.getBoolean("quiet_hours_enabled"),
            start == null ? null : LocalTime.parse(start),
            end == null ? null : LocalTime.parse(end),
            ZoneId.of(rs.getString("quiet_hours_timezone")),
            splitExceptions(rs.getString("quiet_hours_exceptions")));
    return new NotificationPreferences(
        rs.getString("recipient_id"),
        readJson(rs.getString("channels_json"), CHANNELS_TYPE),
        quietHours,
        readJson(rs.getString("rate_limits_json"), RATE_LIMITS_TYPE));
  }

  private static Set<String> splitExceptions(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("preferences are not serializable", ex);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored preferences are malformed", ex);
    }
  }
}
