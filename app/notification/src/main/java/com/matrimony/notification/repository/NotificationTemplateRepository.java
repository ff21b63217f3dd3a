/*
 * どこで: Notification データアクセス
 * 何を: notification_templates から (trigger, channel) の有効な最新版を引く
 * なぜ: テンプレートの差し替えを版の追加だけで行えるようにするため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationTemplate;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationTemplateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<NotificationTemplate> findActive(String trigger, NotificationChannel channel) {
    final String sql =
        """
        SELECT template_id, trigger, channel, subject, body, max_length, enabled, version, updated_at
        FROM notification_templates
        WHERE trigger = :trigger
          AND channel = :channel
          AND enabled
        ORDER BY version DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("trigger", trigger).addValue("channel", channel.name());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void insert(NotificationTemplate template) {
    final String sql =
        """
        INSERT INTO notification_templates (
          template_id, trigger, channel, subject, body, max_length, enabled, version, updated_at
        ) VALUES (
          :templateId, :trigger, :channel, :subject, :body, :maxLength, :enabled, :version, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("templateId", template.templateId())
            .addValue("trigger", template.trigger())
            .addValue("channel", template.channel().name())
            .addValue("subject", template.subject())
            .addValue("body", template.body())
            .addValue("maxLength", template.maxLength())
            .addValue("enabled", template.enabled())
            .addValue("version", template.version())
            .addValue("updatedAt", toTimestamp(template.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  private NotificationTemplate mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int maxLength = rs.getInt("max_length");
    return new NotificationTemplate(
        rs.getString("template_id"),
        rs.getString("trigger"),
        NotificationChannel.valueOf(rs.getString("channel")),
        rs.getString("subject"),
        rs.getString("body"),
        rs.wasNull() ? null : maxLength,
        rs.getBoolean("enabled"),
        rs.getInt("version"),
        getInstant(rs, "updated_at"));
  }
}
