/*
 * どこで: Tracking データアクセス
 * 何を: tracking_events の登録 (開封は重複排除) と集計
 * なぜ: 開封/クリックの分析値を 1 つの表から算出するため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.TrackingEvent;
import com.matrimony.notification.model.TrackingEventType;
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
public class TrackingEventRepository {

  /** 期間内の集計値。uniqueEmails はイベントが 1 件以上ある通知の数。 */
  public record Summary(long opens, long clicks, long uniqueEmails) {}

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 開封イベントを登録する。同じ (tracking_id, ip_masked, user_agent) が既にあれば何もせず false。
   */
  public boolean insertOpenIfAbsent(TrackingEvent event) {
    final String sql =
        """
        INSERT INTO tracking_events (
          event_id, tracking_id, event_type, ip_masked, user_agent, referer, occurred_at
        ) VALUES (
          :eventId, :trackingId, 'OPEN', :ipMasked, :userAgent, :referer, :occurredAt
        )
        ON CONFLICT (tracking_id, ip_masked, user_agent) WHERE event_type = 'OPEN' DO NOTHING
        """;
    return jdbcTemplate.update(sql, toParams(event)) > 0;
  }

  public void insertClick(TrackingEvent event) {
    final String sql =
        """
        INSERT INTO tracking_events (
          event_id, tracking_id, event_type, link_type, destination_url,
          ip_masked, user_agent, referer, occurred_at
        ) VALUES (
          :eventId, :trackingId, 'CLICK', :linkType, :destinationUrl,
          :ipMasked, :userAgent, :referer, :occurredAt
        )
        """;
    jdbcTemplate.update(sql, toParams(event));
  }

  public List<TrackingEvent> findByTrackingId(UUID trackingId) {
    final String sql =
        """
        SELECT event_id, tracking_id, event_type, link_type, destination_url,
               ip_masked, user_agent, referer, occurred_at
        FROM tracking_events
        WHERE tracking_id = :trackingId
        ORDER BY occurred_at, event_id
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("trackingId", trackingId), this::mapRow);
  }

  public Summary summarizeSince(Instant since) {
    final String sql =
        """
        SELECT COUNT(*) FILTER (WHERE event_type = 'OPEN') AS opens,
               COUNT(*) FILTER (WHERE event_type = 'CLICK') AS clicks,
               COUNT(DISTINCT tracking_id) AS unique_emails
        FROM tracking_events
        WHERE occurred_at >= :since
        """;
    return jdbcTemplate.queryForObject(
        sql,
        new MapSqlParameterSource("since", toTimestamp(since)),
        (rs, rowNum) ->
            new Summary(rs.getLong("opens"), rs.getLong("clicks"), rs.getLong("unique_emails")));
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql = "DELETE FROM tracking_events WHERE occurred_at < :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private MapSqlParameterSource toParams(TrackingEvent event) {
    return new MapSqlParameterSource()
        .addValue("eventId", event.eventId())
        .addValue("trackingId", event.trackingId())
        .addValue("linkType", event.linkType())
        .addValue("destinationUrl", event.destinationUrl())
        .addValue("ipMasked", event.ipMasked())
        .addValue("userAgent", event.userAgent())
        .addValue("referer", event.referer())
        .addValue("occurredAt", toTimestamp(event.occurredAt()));
  }

  private TrackingEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TrackingEvent(
        UUID.fromString(rs.getString("event_id")),
        UUID.fromString(rs.getString("tracking_id")),
        TrackingEventType.valueOf(rs.getString("event_type")),
        rs.getString("link_type"),
        rs.getString("destination_url"),
        rs.getString("ip_masked"),
        rs.getString("user_agent"),
        rs.getString("referer"),
        getInstant(rs, "occurred_at"));
  }
}
