/*
 * どこで: Scheduler データアクセス
 * 何を: job_execution_records の登録/終了更新/参照/削除
 * なぜ: 試行ごとの実行履歴を残し、管理 API と保守ジョブから使うため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.JobExecutionRecord;
import com.matrimony.notification.model.JobExecutionStatus;
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
public class JobExecutionRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertRunning(JobExecutionRecord record) {
    final String sql =
        """
        INSERT INTO job_execution_records (
          execution_id, job_name, attempt, status, triggered_by, started_at, execution_host
        ) VALUES (
          :executionId, :jobName, :attempt, :status, :triggeredBy, :startedAt, :executionHost
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", record.executionId())
            .addValue("jobName", record.jobName())
            .addValue("attempt", record.attempt())
            .addValue("status", JobExecutionStatus.RUNNING.name())
            .addValue("triggeredBy", record.triggeredBy())
            .addValue("startedAt", toTimestamp(record.startedAt()))
            .addValue("executionHost", record.executionHost());
    jdbcTemplate.update(sql, params);
  }

  public int finish(JobExecutionRecord record) {
    final String sql =
        """
        UPDATE job_execution_records
        SET status = :status,
            ended_at = :endedAt,
            records_processed = :recordsProcessed,
            records_affected = :recordsAffected,
            message = :message,
            error_message = :errorMessage
        WHERE execution_id = :executionId
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", record.executionId())
            .addValue("status", record.status().name())
            .addValue("endedAt", toTimestamp(record.endedAt()))
            .addValue("recordsProcessed", record.recordsProcessed())
            .addValue("recordsAffected", record.recordsAffected())
            .addValue("message", record.message())
            .addValue("errorMessage", record.errorMessage());
    return jdbcTemplate.update(sql, params);
  }

  public List<JobExecutionRecord> findByJobName(String jobName, int limit) {
    final String sql =
        """
        SELECT execution_id, job_name, attempt, status, triggered_by, started_at, ended_at,
               records_processed, records_affected, message, error_message, execution_host
        FROM job_execution_records
        WHERE job_name = :jobName
        ORDER BY started_at DESC, attempt DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobName", jobName).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM job_execution_records
        WHERE started_at < :threshold
          AND status <> 'RUNNING'
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private JobExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobExecutionRecord(
        UUID.fromString(rs.getString("execution_id")),
        rs.getString("job_name"),
        rs.getInt("attempt"),
        JobExecutionStatus.valueOf(rs.getString("status")),
        rs.getString("triggered_by"),
        getInstant(rs, "started_at"),
        getInstant(rs, "ended_at"),
        rs.getLong("records_processed"),
        rs.getLong("records_affected"),
        rs.getString("message"),
        rs.getString("error_message"),
        rs.getString("execution_host"));
  }
}
