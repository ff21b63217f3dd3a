/*
 * どこで: Notification データアクセス
 * 何を: notification_dlq の登録と参照を担う
 * なぜ: 試行回数を使い切った poison item を隔離して運用介入を可能にするため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationDlqRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 同じ item の 2 回目以降の登録は無視し、false を返す。 */
  public boolean insert(
      UUID dlqId,
      UUID notificationId,
      UUID eventId,
      String payloadJson,
      String errorMessage,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO notification_dlq (
          dlq_id, notification_id, event_id, payload_json, error_message, created_at
        ) VALUES (
          :dlqId, :notificationId, :eventId, :payloadJson::jsonb, :errorMessage, :createdAt
        )
        ON CONFLICT (notification_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dlqId", dlqId)
            .addValue("notificationId", notificationId)
            .addValue("eventId", eventId)
            .addValue("payloadJson", payloadJson)
            .addValue("errorMessage", errorMessage)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int countByNotificationId(UUID notificationId) {
    final String sql =
        "SELECT COUNT(*) FROM notification_dlq WHERE notification_id = :notificationId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("notificationId", notificationId), Integer.class);
    return count == null ? 0 : count;
  }
}
