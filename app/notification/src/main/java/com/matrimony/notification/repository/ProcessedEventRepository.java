/*
 * どこで: Notification データアクセス
 * 何を: processed_events の登録と期限切れ削除を行う
 * なぜ: NATS の at-least-once 配信で同じ依頼を二重に enqueue しないため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public boolean insertIfAbsent(UUID eventId, Instant processedAt) {
        String sql = """
                INSERT INTO processed_events (event_id, processed_at)
                VALUES (:eventId, :processedAt)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("eventId", eventId)
                .addValue("processedAt", toTimestamp(processedAt));
        try {
            return jdbcTemplate.update(sql, params) > 0;
        } catch (DuplicateKeyException ex) {
            // 既に処理済み
            return false;
        }
    }

    public int deleteOlderThan(Instant threshold) {
        String sql = """
                DELETE FROM processed_events
                WHERE processed_at < :threshold
                """;
        return jdbcTemplate.update(sql,
                new MapSqlParameterSource("threshold", toTimestamp(threshold)));
    }
}
