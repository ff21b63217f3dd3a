/*
 * どこで: Scheduler 管理 API
 * 何を: 動的ジョブの作成/更新/有効化/無効化、一覧、即時実行、実行履歴参照
 * なぜ: デプロイなしでジョブの追加や停止、手動再実行を行えるようにするため
 */
package com.matrimony.notification.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matrimony.notification.api.request.JobDefinitionRequest;
import com.matrimony.notification.api.response.JobDefinitionResponse;
import com.matrimony.notification.api.response.JobExecutionResponse;
import com.matrimony.notification.job.JobExecutor;
import com.matrimony.notification.job.JobRegistry;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.repository.JobExecutionRecordRepository;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/jobs")
@RequiredArgsConstructor
public class JobAdminController {

  private static final int MAX_EXECUTIONS = 500;

  private final JobRegistry registry;
  private final JobExecutor executor;
  private final JobExecutionRecordRepository executionRecordRepository;
  private final ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<JobDefinitionResponse> create(
      @Valid @RequestBody JobDefinitionRequest request) {
    final JobDefinition created = registry.registerDynamic(request.toRegistration());
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
  }

  @PutMapping("/{name}")
  public JobDefinitionResponse update(
      @PathVariable("name") String name, @Valid @RequestBody JobDefinitionRequest request) {
    return toResponse(registry.update(name, request.toRegistration()));
  }

  @PostMapping("/{name}/enable")
  public JobDefinitionResponse enable(@PathVariable("name") String name) {
    return toResponse(registry.setEnabled(name, true));
  }

  @PostMapping("/{name}/disable")
  public JobDefinitionResponse disable(@PathVariable("name") String name) {
    return toResponse(registry.setEnabled(name, false));
  }

  @GetMapping
  public List<JobDefinitionResponse> list() {
    return registry.list().stream().map(this::toResponse).toList();
  }

  @GetMapping("/{name}")
  public JobDefinitionResponse get(@PathVariable("name") String name) {
    return toResponse(registry.get(name));
  }

  /** 同期で 1 回実行する。スケジュール (next_run_at) は動かさない。 */
  @PostMapping("/{name}/run")
  public JobExecutionResponse runNow(@PathVariable("name") String name) {
    final JobDefinition job = registry.get(name);
    return JobExecutionResponse.from(executor.execute(job, JobExecutor.TRIGGERED_BY_MANUAL));
  }

  @GetMapping("/{name}/executions")
  public List<JobExecutionResponse> executions(
      @PathVariable("name") String name,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit <= 0 || limit > MAX_EXECUTIONS) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_EXECUTIONS);
    }
    registry.get(name);
    return executionRecordRepository.findByJobName(name, limit).stream()
        .map(JobExecutionResponse::from)
        .toList();
  }

  private JobDefinitionResponse toResponse(JobDefinition job) {
    return JobDefinitionResponse.from(job, objectMapper);
  }
}
