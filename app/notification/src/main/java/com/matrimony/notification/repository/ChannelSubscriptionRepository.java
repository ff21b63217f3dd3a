/*
 * どこで: Push データアクセス
 * 何を: channel_subscriptions (デバイストークン) の登録/無効化/参照
 * なぜ: push 配信先の解決と無効トークンの除外を行うため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.ChannelSubscription;
import com.matrimony.notification.model.DevicePlatform;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ChannelSubscriptionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 同じトークンの再登録は持ち主と platform を更新して再び有効にする。 */
  public void upsert(String recipientId, String deviceToken, DevicePlatform platform, Instant now) {
    final String sql =
        """
        INSERT INTO channel_subscriptions (
          device_token, recipient_id, platform, active, created_at, updated_at
        ) VALUES (
          :deviceToken, :recipientId, :platform, TRUE, :now, :now
        )
        ON CONFLICT (device_token) DO UPDATE
        SET recipient_id = EXCLUDED.recipient_id,
            platform = EXCLUDED.platform,
            active = TRUE,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deviceToken", deviceToken)
            .addValue("recipientId", recipientId)
            .addValue("platform", platform.name())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public int deactivate(String deviceToken, Instant now) {
    final String sql =
        """
        UPDATE channel_subscriptions
        SET active = FALSE,
            updated_at = :now,
            last_failure_at = :now
        WHERE device_token = :deviceToken
          AND active
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deviceToken", deviceToken)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<ChannelSubscription> findActiveByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT recipient_id, device_token, platform, active, created_at, updated_at
        FROM channel_subscriptions
        WHERE recipient_id = :recipientId
          AND active
        ORDER BY updated_at DESC
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("recipientId", recipientId), this::mapRow);
  }

  private ChannelSubscription mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ChannelSubscription(
        rs.getString("recipient_id"),
        rs.getString("device_token"),
        DevicePlatform.valueOf(rs.getString("platform")),
        rs.getBoolean("active"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
