/*
 * どこで: Scheduler 管理 API の Web 層テスト
 * 何を: 動的ジョブの登録/更新/手動実行と、エラーコードへの変換を検証する
 * なぜ: 運用者が API 経由でジョブを操作したときの応答形を固定するため
 */
package com.matrimony.notification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.matrimony.notification.job.DuplicateJobException;
import com.matrimony.notification.job.JobExecutor;
import com.matrimony.notification.job.JobNotFoundException;
import com.matrimony.notification.job.JobRegistration;
import com.matrimony.notification.job.JobRegistry;
import com.matrimony.notification.model.JobDefinition;
import com.matrimony.notification.model.JobExecutionRecord;
import com.matrimony.notification.model.JobExecutionStatus;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.model.JobOrigin;
import com.matrimony.notification.model.JobSchedule;
import com.matrimony.notification.model.RetryPolicy;
import com.matrimony.notification.model.ScheduleKind;
import com.matrimony.notification.repository.JobExecutionRecordRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(JobAdminController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class JobAdminControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-10T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private JobRegistry registry;
  @MockitoBean private JobExecutor executor;
  @MockitoBean private JobExecutionRecordRepository executionRecordRepository;

  @Test
  void createCronJobReturns201() throws Exception {
    when(registry.registerDynamic(any(JobRegistration.class)))
        .thenReturn(
            job(
                "weekly-digest",
                JobOrigin.DYNAMIC,
                JobSchedule.cron("0 9 * * MON", "Asia/Kolkata"),
                "{\"batch_size\":20}"));

    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "weekly-digest",
                      "job_type": "notification_dispatch",
                      "cron_expression": "0 9 * * MON",
                      "timezone": "Asia/Kolkata",
                      "timeout_seconds": 120,
                      "max_retries": 2,
                      "retry_delay_seconds": 30,
                      "parameters": {"batch_size": 20},
                      "created_by": "ops"
                    }
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("weekly-digest"))
        .andExpect(jsonPath("$.origin").value("DYNAMIC"))
        .andExpect(jsonPath("$.job_type").value("notification_dispatch"))
        .andExpect(jsonPath("$.schedule_kind").value("CRON"))
        .andExpect(jsonPath("$.timezone").value("Asia/Kolkata"))
        .andExpect(jsonPath("$.parameters.batch_size").value(20));

    final ArgumentCaptor<JobRegistration> captor = ArgumentCaptor.forClass(JobRegistration.class);
    verify(registry).registerDynamic(captor.capture());
    final JobRegistration registration = captor.getValue();
    assertThat(registration.kind()).isEqualTo(JobKind.NOTIFICATION_DISPATCH);
    assertThat(registration.schedule().kind()).isEqualTo(ScheduleKind.CRON);
    assertThat(registration.enabled()).isTrue();
    assertThat(registration.retryPolicy()).isEqualTo(new RetryPolicy(2, 30));
    assertThat(registration.createdBy()).isEqualTo("ops");
  }

  @Test
  void createRejectsBothIntervalAndCron() throws Exception {
    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "name": "bad",
                      "job_type": "notification_dispatch",
                      "interval_seconds": 60,
                      "cron_expression": "*/5 * * * *",
                      "timeout_seconds": 30
                    }
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_BAD_REQUEST"))
        .andExpect(
            jsonPath("$.message")
                .value("exactly one of interval_seconds or cron_expression is required"));

    verify(registry, never()).registerDynamic(any());
  }

  @Test
  void createRejectsUnknownJobType() throws Exception {
    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","job_type":"mine_bitcoin","interval_seconds":60,"timeout_seconds":30}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("unknown job_type: mine_bitcoin"));
  }

  @Test
  void createRejectsRetryValuesOutOfRange() throws Exception {
    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","job_type":"notification_dispatch","interval_seconds":60,
                     "timeout_seconds":30,"max_retries":2147483647}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));
    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","job_type":"notification_dispatch","interval_seconds":60,
                     "timeout_seconds":86401,"max_retries":1,"retry_delay_seconds":0}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));

    verify(registry, never()).registerDynamic(any());
  }

  @Test
  void createRequiresTimeout() throws Exception {
    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","job_type":"notification_dispatch","interval_seconds":60}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));
  }

  @Test
  void createReturns409WhenNameTaken() throws Exception {
    when(registry.registerDynamic(any(JobRegistration.class)))
        .thenThrow(new DuplicateJobException("hourly", new DuplicateKeyException("dup")));

    mockMvc
        .perform(
            post("/admin/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"hourly","job_type":"notification_dispatch","interval_seconds":3600,"timeout_seconds":30}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("JOB_ALREADY_EXISTS"));
  }

  @Test
  void updateOfStaticJobIsRejected() throws Exception {
    when(registry.update(eq("notification-dispatch"), any(JobRegistration.class)))
        .thenThrow(new IllegalArgumentException("static jobs cannot be modified via api"));

    mockMvc
        .perform(
            put("/admin/jobs/notification-dispatch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"notification-dispatch","job_type":"notification_dispatch","interval_seconds":30,"timeout_seconds":30}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_BAD_REQUEST"));
  }

  @Test
  void disableReturnsUpdatedJob() throws Exception {
    final JobDefinition job = job("hourly", JobOrigin.DYNAMIC, JobSchedule.interval(3600), "{}");
    when(registry.setEnabled("hourly", false)).thenReturn(disabled(job));

    mockMvc
        .perform(post("/admin/jobs/hourly/disable"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(false))
        .andExpect(jsonPath("$.interval_seconds").value(3600));
  }

  @Test
  void getUnknownJobReturns404() throws Exception {
    when(registry.get("missing")).thenThrow(new JobNotFoundException("missing"));

    mockMvc
        .perform(get("/admin/jobs/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("JOB_NOT_FOUND"));
  }

  @Test
  void listReturnsAllJobs() throws Exception {
    when(registry.list())
        .thenReturn(
            List.of(
                job("a", JobOrigin.STATIC, JobSchedule.interval(60), "{}"),
                job("b", JobOrigin.DYNAMIC, JobSchedule.interval(120), null)));

    mockMvc
        .perform(get("/admin/jobs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[1].name").value("b"));
  }

  @Test
  void runNowExecutesSynchronouslyAsManual() throws Exception {
    final JobDefinition job = job("hourly", JobOrigin.DYNAMIC, JobSchedule.interval(3600), "{}");
    when(registry.get("hourly")).thenReturn(job);
    when(executor.execute(job, JobExecutor.TRIGGERED_BY_MANUAL)).thenReturn(record("hourly"));

    mockMvc
        .perform(post("/admin/jobs/hourly/run"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.job_name").value("hourly"))
        .andExpect(jsonPath("$.status").value("SUCCESS"))
        .andExpect(jsonPath("$.triggered_by").value("manual"))
        .andExpect(jsonPath("$.records_processed").value(12));

    verify(registry, never()).markExecuted(any(), any(), any());
  }

  @Test
  void executionsRejectsOutOfRangeLimit() throws Exception {
    mockMvc
        .perform(get("/admin/jobs/hourly/executions").param("limit", "0"))
        .andExpect(status().isBadRequest());

    verify(executionRecordRepository, never()).findByJobName(anyString(), anyInt());
  }

  @Test
  void executionsReturnsHistory() throws Exception {
    when(registry.get("hourly"))
        .thenReturn(job("hourly", JobOrigin.DYNAMIC, JobSchedule.interval(3600), "{}"));
    when(executionRecordRepository.findByJobName("hourly", 10)).thenReturn(List.of(record("hourly")));

    mockMvc
        .perform(get("/admin/jobs/hourly/executions").param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].execution_host").value("worker-1"));
  }

  private static JobDefinition job(
      String name, JobOrigin origin, JobSchedule schedule, String parametersJson) {
    return new JobDefinition(
        name,
        origin,
        JobKind.NOTIFICATION_DISPATCH,
        schedule,
        true,
        120,
        new RetryPolicy(2, 30),
        parametersJson,
        null,
        "ops",
        null,
        NOW,
        null,
        NOW,
        NOW,
        0);
  }

  private static JobDefinition disabled(JobDefinition job) {
    return new JobDefinition(
        job.name(),
        job.origin(),
        job.kind(),
        job.schedule(),
        false,
        job.timeoutSeconds(),
        job.retryPolicy(),
        job.parametersJson(),
        job.description(),
        job.createdBy(),
        job.lastRunAt(),
        job.nextRunAt(),
        job.lastStatus(),
        job.createdAt(),
        NOW,
        job.version() + 1);
  }

  private static JobExecutionRecord record(String name) {
    return new JobExecutionRecord(
        UUID.fromString("0d6f0c55-3f7a-4d39-9d1b-1f5f7e0c2a10"),
        name,
        1,
        JobExecutionStatus.SUCCESS,
        JobExecutor.TRIGGERED_BY_MANUAL,
        NOW,
        NOW.plusSeconds(2),
        12,
        10,
        "dispatched",
        null,
        "worker-1");
  }
}
