/*
 * どこで: Scheduler ジョブ登録
 * 何を: ジョブ定義の登録/更新/有効化と、期限到来ジョブの取得・実行後の次回時刻更新
 * なぜ: 静的ジョブと動的ジョブを同じテーブル・同じ期限判定で扱うため
 */
package com.matrimony.notification.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobExecutionStatus;
import com.matrimony.notification.model.JobOrigin;
import com.matrimony.notification.repository.JobDefinitionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

  private final JobDefinitionRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * 設定由来のジョブを upsert する。スケジュールが変わらなければ next_run_at を保つ。
   */
  public JobDefinition registerStatic(JobRegistration registration) {
    final Instant now = Instant.now(clock);
    final Optional<JobDefinition> existing = repository.findByName(registration.name());
    if (existing.isEmpty()) {
      final JobDefinition created = newDefinition(registration, JobOrigin.STATIC, now);
      repository.insert(created);
      logger.info(
          "static job registered name={} kind={} nextRunAt={}",
          created.name(),
          created.kind(),
          created.nextRunAt());
      return created;
    }
    final JobDefinition current = existing.get();
    if (current.origin() != JobOrigin.STATIC) {
      throw new DuplicateJobException(registration.name(), null);
    }
    final Instant nextRunAt =
        current.schedule().equals(registration.schedule()) && current.nextRunAt() != null
            ? current.nextRunAt()
            : registration.schedule().firstRunAt(now);
    final JobDefinition updated = merge(current, registration, nextRunAt, now);
    repository.update(updated);
    logger.info(
        "static job refreshed name={} kind={} nextRunAt={}",
        updated.name(),
        updated.kind(),
        updated.nextRunAt());
    return updated;
  }

  public JobDefinition registerDynamic(JobRegistration registration) {
    final JobDefinition created =
        newDefinition(registration, JobOrigin.DYNAMIC, Instant.now(clock));
    try {
      repository.insert(created);
    } catch (DuplicateKeyException ex) {
      throw new DuplicateJobException(registration.name(), ex);
    }
    logger.info(
        "dynamic job registered name={} kind={} createdBy={} nextRunAt={}",
        created.name(),
        created.kind(),
        created.createdBy(),
        created.nextRunAt());
    return created;
  }

  /** 動的ジョブの定義を置き換える。静的ジョブは設定ファイルでのみ変更できる。 */
  public JobDefinition update(String name, JobRegistration registration) {
    final JobDefinition current = get(name);
    requireDynamic(current);
    if (!current.name().equals(registration.name())) {
      throw new IllegalArgumentException("job name cannot be changed");
    }
    final Instant now = Instant.now(clock);
    final Instant nextRunAt =
        current.schedule().equals(registration.schedule()) && current.nextRunAt() != null
            ? current.nextRunAt()
            : registration.schedule().firstRunAt(now);
    final JobDefinition updated = merge(current, registration, nextRunAt, now);
    if (repository.update(updated) == 0) {
      throw new JobNotFoundException(name);
    }
    logger.info("dynamic job updated name={} nextRunAt={}", name, updated.nextRunAt());
    return updated;
  }

  public JobDefinition setEnabled(String name, boolean enabled) {
    final JobDefinition current = get(name);
    final Instant now = Instant.now(clock);
    // 再有効化時は停止中の取りこぼしをまとめて走らせず、スケジュールを今から数え直す
    final Instant nextRunAt =
        enabled && !current.enabled() ? current.schedule().firstRunAt(now) : current.nextRunAt();
    if (repository.setEnabled(name, enabled, nextRunAt, now) == 0) {
      throw new JobNotFoundException(name);
    }
    logger.info("job {} name={} nextRunAt={}", enabled ? "enabled" : "disabled", name, nextRunAt);
    return get(name);
  }

  public JobDefinition get(String name) {
    return repository.findByName(name).orElseThrow(() -> new JobNotFoundException(name));
  }

  public List<JobDefinition> list() {
    return repository.findAll();
  }

  public List<JobDefinition> listDueJobs(Instant now) {
    return repository.findDue(now);
  }

  /** last_run_at を now にし、次回時刻をスケジュールから求める。 */
  public Instant markExecuted(JobDefinition job, Instant now, JobExecutionStatus lastStatus) {
    final Instant nextRunAt = job.schedule().nextRunAfter(now);
    repository.markExecuted(job.name(), now, nextRunAt, lastStatus);
    return nextRunAt;
  }

  private JobDefinition newDefinition(JobRegistration registration, JobOrigin origin, Instant now) {
    return new JobDefinition(
        registration.name(),
        origin,
        registration.kind(),
        registration.schedule(),
        registration.enabled(),
        registration.timeoutSeconds(),
        registration.retryPolicy(),
        toJson(registration),
        registration.description(),
        registration.createdBy(),
        null,
        registration.schedule().firstRunAt(now),
        null,
        now,
        now,
        0);
  }

  private JobDefinition merge(
      JobDefinition current, JobRegistration registration, Instant nextRunAt, Instant now) {
    return new JobDefinition(
        current.name(),
        current.origin(),
        registration.kind(),
        registration.schedule(),
        registration.enabled(),
        registration.timeoutSeconds(),
        registration.retryPolicy(),
        toJson(registration),
        registration.description(),
        current.createdBy(),
        current.lastRunAt(),
        nextRunAt,
        current.lastStatus(),
        current.createdAt(),
        now,
        current.version() + 1);
  }

  private static void requireDynamic(JobDefinition job) {
    if (job.origin() != JobOrigin.DYNAMIC) {
      throw new IllegalArgumentException("static job is managed by configuration: " + job.name());
    }
  }

  private String toJson(JobRegistration registration) {
    try {
      return objectMapper.writeValueAsString(registration.parameters());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("parameters are not serializable", ex);
    }
  }
}
