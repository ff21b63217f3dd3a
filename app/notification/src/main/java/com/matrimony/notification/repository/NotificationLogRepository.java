/*
 * どこで: Notification データアクセス
 * 何を: notification_log (チャネル単位の配信結果) の登録と参照
 * なぜ: 配信結果と分析値の集計元を残すため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationLogEntry;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertAll(List<NotificationLogEntry> entries) {
    final String sql =
        """
        INSERT INTO notification_log (
          log_id, notification_id, recipient_id, trigger, channel, priority, status,
          provider_used, subject, preview, delivered_count, failed_count, error_message, created_at
        ) VALUES (
          :logId, :notificationId, :recipientId, :trigger, :channel, :priority, :status,
          :providerUsed, :subject, :preview, :deliveredCount, :failedCount, :errorMessage, :createdAt
        )
        """;
    final MapSqlParameterSource[] batch =
        entries.stream()
            .map(
                entry ->
                    new MapSqlParameterSource()
                        .addValue("logId", entry.logId())
                        .addValue("notificationId", entry.notificationId())
                        .addValue("recipientId", entry.recipientId())
                        .addValue("trigger", entry.trigger())
                        .addValue("channel", entry.channel().name())
                        .addValue("priority", entry.priority().name())
                        .addValue("status", entry.status().name())
                        .addValue("providerUsed", entry.providerUsed())
                        .addValue("subject", entry.subject())
                        .addValue("preview", entry.preview())
                        .addValue("deliveredCount", entry.deliveredCount())
                        .addValue("failedCount", entry.failedCount())
                        .addValue("errorMessage", entry.errorMessage())
                        .addValue("createdAt", toTimestamp(entry.createdAt())))
            .toArray(MapSqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public List<NotificationLogEntry> findByNotificationId(UUID notificationId) {
    final String sql =
        """
        SELECT log_id, notification_id, recipient_id, trigger, channel, priority, status,
               provider_used, subject, preview, delivered_count, failed_count, error_message, created_at
        FROM notification_log
        WHERE notification_id = :notificationId
        ORDER BY created_at, channel
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("notificationId", notificationId), this::mapRow);
  }

  public long countSentSince(NotificationChannel channel, Instant since) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_log
        WHERE channel = :channel
          AND status = 'SENT'
          AND created_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("channel", channel.name())
            .addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  /** 受信者・チャネル単位の送信済み件数。レート制限の判定に使う。 */
  public long countSentToRecipientSince(
      String recipientId, NotificationChannel channel, Instant since) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_log
        WHERE recipient_id = :recipientId
          AND channel = :channel
          AND status = 'SENT'
          AND created_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("channel", channel.name())
            .addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  private NotificationLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationLogEntry(
        UUID.fromString(rs.getString("log_id")),
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("recipient_id"),
        rs.getString("trigger"),
        NotificationChannel.valueOf(rs.getString("channel")),
        NotificationPriority.valueOf(rs.getString("priority")),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getString("provider_used"),
        rs.getString("subject"),
        rs.getString("preview"),
        rs.getInt("delivered_count"),
        rs.getInt("failed_count"),
        rs.getString("error_message"),
        getInstant(rs, "created_at"));
  }
}
