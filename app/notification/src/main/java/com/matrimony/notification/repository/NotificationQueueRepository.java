/*
 * どこで: Notification データアクセス
 * 何を: notification_queue の登録/claim/状態遷移/集計を担う
 * なぜ: 配信パス・トラッキング・保守ジョブが同じ行を一貫した条件で更新するため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationQueueRepository {

  private static final String COLUMNS =
      """
      notification_id, event_id, parent_id, recipient_id, trigger, priority, channels,
      template_data_json::text AS template_data_json_text, status, attempts, scheduled_for,
      claim_token, claimed_at, lease_until, last_error, open_count, click_count,
      created_at, updated_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationQueueItem item) {
    final String sql =
        """
        INSERT INTO notification_queue (
          notification_id, event_id, parent_id, recipient_id, trigger, priority, channels,
          template_data_json, status, attempts, scheduled_for, created_at, updated_at
        ) VALUES (
          :notificationId, :eventId, :parentId, :recipientId, :trigger, :priority, :channels,
          :templateDataJson::jsonb, :status, :attempts, :scheduledFor, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", item.notificationId())
            .addValue("eventId", item.eventId())
            .addValue("parentId", item.parentId())
            .addValue("recipientId", item.recipientId())
            .addValue("trigger", item.trigger())
            .addValue("priority", item.priority().name())
            .addValue("channels", joinChannels(item.channels()))
            .addValue("templateDataJson", item.templateDataJson())
            .addValue("status", item.status().name())
            .addValue("attempts", item.attempts())
            .addValue("scheduledFor", toTimestamp(item.scheduledFor()))
            .addValue("createdAt", toTimestamp(item.createdAt()))
            .addValue("updatedAt", toTimestamp(item.updatedAt()));
    jdbcTemplate.update(sql, params);
    return item.notificationId();
  }

  public Optional<NotificationQueueItem> findById(UUID notificationId) {
    final String sql = "SELECT " + COLUMNS + " FROM notification_queue WHERE notification_id = :id";
    final List<NotificationQueueItem> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource("id", notificationId), this::mapRow);
    return rows.stream().findFirst();
  }

  public List<NotificationQueueItem> findByRecipientId(String recipientId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_queue
            WHERE recipient_id = :recipientId
            ORDER BY created_at DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 期限到来の PENDING と lease 切れの PROCESSING を 1 文で claim する。
   *
   * <p>優先度 (critical &gt; high &gt; medium &gt; low)、scheduled_for の順で取り出し、同時に走る別の
   * パスとは SKIP LOCKED で行が重ならない。返る行の claim_token は呼び出し元が以降の更新で使う。
   */
  public List<NotificationQueueItem> claimDue(
      int limit, Instant now, Instant leaseUntil, String claimToken) {
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM notification_queue
          WHERE (status = 'PENDING' AND scheduled_for <= :now)
             OR (status = 'PROCESSING' AND (lease_until IS NULL OR lease_until <= :now))
          ORDER BY CASE priority
                     WHEN 'CRITICAL' THEN 3
                     WHEN 'HIGH' THEN 2
                     WHEN 'MEDIUM' THEN 1
                     ELSE 0
                   END DESC,
                   scheduled_for
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_queue q
        SET status = 'PROCESSING',
            claim_token = :claimToken,
            claimed_at = :now,
            lease_until = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE q.notification_id = cte.notification_id
        RETURNING q.notification_id, q.event_id, q.parent_id, q.recipient_id, q.trigger,
                  q.priority, q.channels, q.template_data_json::text AS template_data_json_text,
                  q.status, q.attempts, q.scheduled_for, q.claim_token, q.claimed_at,
                  q.lease_until, q.last_error, q.open_count, q.click_count,
                  q.created_at, q.updated_at, q.completed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("claimToken", claimToken)
            .addValue("limit", limit);
    final List<NotificationQueueItem> claimed = jdbcTemplate.query(sql, params, this::mapRow);
    // RETURNING は順序を保証しないので取り出し順に並べ直す
    final List<NotificationQueueItem> ordered = new ArrayList<>(claimed);
    ordered.sort(
        (a, b) -> {
          final int byPriority = Integer.compare(b.priority().rank(), a.priority().rank());
          return byPriority != 0 ? byPriority : a.scheduledFor().compareTo(b.scheduledFor());
        });
    return ordered;
  }

  /** PROCESSING から終端状態へ。claim を失っていれば 0 を返す。 */
  public int complete(
      UUID notificationId,
      String claimToken,
      NotificationStatus status,
      int attempts,
      String lastError,
      Instant completedAt) {
    if (!status.isTerminal()) {
      throw new IllegalArgumentException("terminal status required: " + status);
    }
    final String sql =
        """
        UPDATE notification_queue
        SET status = :status,
            attempts = :attempts,
            last_error = :lastError,
            completed_at = :completedAt,
            updated_at = :completedAt,
            claim_token = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND claim_token = :claimToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("attempts", attempts)
            .addValue("lastError", lastError)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("notificationId", notificationId)
            .addValue("claimToken", claimToken);
    return jdbcTemplate.update(sql, params);
  }

  /** 一時失敗の item を PENDING に戻し、scheduled_for を backoff 後にずらす。 */
  public int release(
      UUID notificationId,
      String claimToken,
      int attempts,
      Instant nextScheduledFor,
      String lastError,
      Instant now) {
    final String sql =
        """
        UPDATE notification_queue
        SET status = 'PENDING',
            attempts = :attempts,
            scheduled_for = :nextScheduledFor,
            last_error = :lastError,
            updated_at = :now,
            claim_token = NULL,
            claimed_at = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND claim_token = :claimToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attempts", attempts)
            .addValue("nextScheduledFor", toTimestamp(nextScheduledFor))
            .addValue("lastError", lastError)
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId)
            .addValue("claimToken", claimToken);
    return jdbcTemplate.update(sql, params);
  }

  public int incrementOpenCount(UUID notificationId, Instant openedAt) {
    final String sql =
        """
        UPDATE notification_queue
        SET open_count = open_count + 1,
            first_opened_at = COALESCE(first_opened_at, :openedAt)
        WHERE notification_id = :notificationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("openedAt", toTimestamp(openedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int incrementClickCount(UUID notificationId, Instant clickedAt) {
    final String sql =
        """
        UPDATE notification_queue
        SET click_count = click_count + 1,
            last_clicked_at = :clickedAt
        WHERE notification_id = :notificationId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("clickedAt", toTimestamp(clickedAt));
    return jdbcTemplate.update(sql, params);
  }

  public Optional<Instant> findFirstOpenedAt(UUID notificationId) {
    final String sql =
        "SELECT first_opened_at FROM notification_queue WHERE notification_id = :id";
    final List<Instant> rows =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource("id", notificationId),
            (rs, rowNum) -> getInstant(rs, "first_opened_at"));
    return rows.stream().filter(v -> v != null).findFirst();
  }

  /**
   * 再投入候補: since 以降に FAILED になった元 item のうち、DLQ に入っておらず派生コピーも無いもの。
   */
  public List<NotificationQueueItem> findRequeueCandidates(Instant since, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_queue q
            WHERE q.status = 'FAILED'
              AND q.completed_at >= :since
              AND NOT EXISTS (
                SELECT 1 FROM notification_dlq d WHERE d.notification_id = q.notification_id)
              AND NOT EXISTS (
                SELECT 1 FROM notification_queue c WHERE c.parent_id = q.notification_id)
            ORDER BY q.completed_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_queue
        WHERE created_at < :threshold
          AND status IN ('SENT', 'FAILED', 'SKIPPED')
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_queue
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)), Integer.class);
    return count == null ? 0 : count;
  }

  public long countBacklog(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_queue
        WHERE status = 'PENDING'
          AND scheduled_for <= :now
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("now", toTimestamp(now)), Long.class);
    return count == null ? 0 : count;
  }

  private static String joinChannels(List<NotificationChannel> channels) {
    return String.join(",", channels.stream().map(NotificationChannel::value).toList());
  }

  private static List<NotificationChannel> splitChannels(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    final List<NotificationChannel> channels = new ArrayList<>();
    for (String part : value.split(",")) {
      if (!part.isBlank()) {
        channels.add(NotificationChannel.fromValue(part));
      }
    }
    return channels;
  }

  private NotificationQueueItem mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String eventId = rs.getString("event_id");
    final String parentId = rs.getString("parent_id");
    return new NotificationQueueItem(
        UUID.fromString(rs.getString("notification_id")),
        eventId == null ? null : UUID.fromString(eventId),
        parentId == null ? null : UUID.fromString(parentId),
        rs.getString("recipient_id"),
        rs.getString("trigger"),
        NotificationPriority.fromValue(rs.getString("priority")),
        splitChannels(rs.getString("channels")),
        rs.getString("template_data_json_text"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        getInstant(rs, "scheduled_for"),
        rs.getString("claim_token"),
        getInstant(rs, "claimed_at"),
        getInstant(rs, "lease_until"),
        rs.getString("last_error"),
        rs.getInt("open_count"),
        rs.getInt("click_count"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"),
        getInstant(rs, "completed_at"));
  }
}
