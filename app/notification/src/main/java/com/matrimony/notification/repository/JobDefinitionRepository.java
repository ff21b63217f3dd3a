/*
 * どこで: Scheduler データアクセス
 * 何を: job_definitions の登録/更新/期限到来ジョブの取得を担う
 * なぜ: 静的ジョブと動的ジョブを 1 つの表で同じ条件でスケジュールするため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.getInstant;
import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobExecutionStatus;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.model.JobOrigin;
import com.matrimony.notification.model.JobSchedule;
import com.matrimony.notification.model.RetryPolicy;
import com.matrimony.notification.model.ScheduleKind;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobDefinitionRepository {

  private static final String COLUMNS =
      """
      name, origin, kind, schedule_kind, interval_seconds, cron_expression, timezone, enabled,
      timeout_seconds, max_retries, retry_delay_seconds, parameters_json::text AS parameters_json_text,
      description, created_by, last_run_at, next_run_at, last_status, created_at, updated_at, version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** name が既に存在する場合は DuplicateKeyException を投げる。 */
  public void insert(JobDefinition job) {
    final String sql =
        """
        INSERT INTO job_definitions (
          name, origin, kind, schedule_kind, interval_seconds, cron_expression, timezone,
          enabled, timeout_seconds, max_retries, retry_delay_seconds, parameters_json,
          description, created_by, next_run_at, created_at, updated_at, version
        ) VALUES (
          :name, :origin, :kind, :scheduleKind, :intervalSeconds, :cronExpression, :timezone,
          :enabled, :timeoutSeconds, :maxRetries, :retryDelaySeconds, :parametersJson::jsonb,
          :description, :createdBy, :nextRunAt, :createdAt, :updatedAt, :version
        )
        """;
    jdbcTemplate.update(sql, toParams(job));
  }

  /** 定義内容を上書きする。last_run_at と last_status は実行側の値を保つ。 */
  public int update(JobDefinition job) {
    final String sql =
        """
        UPDATE job_definitions
        SET kind = :kind,
            schedule_kind = :scheduleKind,
            interval_seconds = :intervalSeconds,
            cron_expression = :cronExpression,
            timezone = :timezone,
            enabled = :enabled,
            timeout_seconds = :timeoutSeconds,
            max_retries = :maxRetries,
            retry_delay_seconds = :retryDelaySeconds,
            parameters_json = :parametersJson::jsonb,
            description = :description,
            next_run_at = :nextRunAt,
            updated_at = :updatedAt,
            version = version + 1
        WHERE name = :name
        """;
    return jdbcTemplate.update(sql, toParams(job));
  }

  public Optional<JobDefinition> findByName(String name) {
    final String sql = "SELECT " + COLUMNS + " FROM job_definitions WHERE name = :name";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("name", name), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<JobDefinition> findAll() {
    final String sql = "SELECT " + COLUMNS + " FROM job_definitions ORDER BY name";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<JobDefinition> findDue(Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM job_definitions
            WHERE enabled
              AND next_run_at IS NOT NULL
              AND next_run_at <= :now
            ORDER BY next_run_at, name
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("now", toTimestamp(now)), this::mapRow);
  }

  public int markExecuted(
      String name, Instant lastRunAt, Instant nextRunAt, JobExecutionStatus lastStatus) {
    final String sql =
        """
        UPDATE job_definitions
        SET last_run_at = :lastRunAt,
            next_run_at = :nextRunAt,
            last_status = :lastStatus,
            updated_at = :lastRunAt
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("lastStatus", lastStatus == null ? null : lastStatus.name());
    return jdbcTemplate.update(sql, params);
  }

  public int setEnabled(String name, boolean enabled, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE job_definitions
        SET enabled = :enabled,
            next_run_at = :nextRunAt,
            updated_at = :now,
            version = version + 1
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("enabled", enabled)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource toParams(JobDefinition job) {
    final JobSchedule schedule = job.schedule();
    return new MapSqlParameterSource()
        .addValue("name", job.name())
        .addValue("origin", job.origin().name())
        .addValue("kind", job.kind().value())
        .addValue("scheduleKind", schedule.kind().name())
        .addValue("intervalSeconds", schedule.intervalSeconds())
        .addValue("cronExpression", schedule.cronExpression())
        .addValue("timezone", schedule.timezone().getId())
        .addValue("enabled", job.enabled())
        .addValue("timeoutSeconds", job.timeoutSeconds())
        .addValue("maxRetries", job.retryPolicy().maxRetries())
        .addValue("retryDelaySeconds", job.retryPolicy().retryDelaySeconds())
        .addValue("parametersJson", job.parametersJson() == null ? "{}" : job.parametersJson())
        .addValue("description", job.description())
        .addValue("createdBy", job.createdBy())
        .addValue("nextRunAt", toTimestamp(job.nextRunAt()))
        .addValue("createdAt", toTimestamp(job.createdAt()))
        .addValue("updatedAt", toTimestamp(job.updatedAt()))
        .addValue("version", job.version());
  }

  private JobDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
    final ScheduleKind scheduleKind = ScheduleKind.valueOf(rs.getString("schedule_kind"));
    final long intervalSeconds = rs.getLong("interval_seconds");
    final JobSchedule schedule =
        new JobSchedule(
            scheduleKind,
            rs.wasNull() ? null : intervalSeconds,
            rs.getString("cron_expression"),
            ZoneId.of(rs.getString("timezone")));
    final String lastStatus = rs.getString("last_status");
    return new JobDefinition(
        rs.getString("name"),
        JobOrigin.valueOf(rs.getString("origin")),
        JobKind.fromValue(rs.getString("kind")),
        schedule,
        rs.getBoolean("enabled"),
        rs.getLong("timeout_seconds"),
        new RetryPolicy(rs.getInt("max_retries"), rs.getLong("retry_delay_seconds")),
        rs.getString("parameters_json_text"),
        rs.getString("description"),
        rs.getString("created_by"),
        getInstant(rs, "last_run_at"),
        getInstant(rs, "next_run_at"),
        lastStatus == null ? null : JobExecutionStatus.valueOf(lastStatus),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"),
        rs.getInt("version"));
  }
}
