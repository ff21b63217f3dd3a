/*
 * どこで: Scheduler の設定バインド
 * 何を: tick 間隔/エラー backoff/プールサイズ/静的ジョブ定義を保持する
 * なぜ: 静的ジョブを設定ファイルから宣言し、起動時に registry へ upsert するため
 */
package com.matrimony.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "scheduler")
@Validated
public record SchedulerProperties(
    boolean enabled,
    @NotNull Duration tickInterval,
    @NotNull Duration errorBackoff,
    @Positive int jobPoolSize,
    @Positive int handlerPoolSize,
    @Valid List<StaticJob> staticJobs) {

  public SchedulerProperties {
    staticJobs = staticJobs == null ? List.of() : List.copyOf(staticJobs);
  }

  @AssertTrue(message = "scheduler.error-backoff must not be negative")
  public boolean isErrorBackoffValid() {
    return errorBackoff == null || !errorBackoff.isNegative();
  }

  /** 設定ファイルで宣言する静的ジョブ。interval-seconds か cron のどちらかを指定する。 */
  public record StaticJob(
      @NotBlank String name,
      @NotBlank String kind,
      Long intervalSeconds,
      String cron,
      String timezone,
      @Positive @Max(86_400) long timeoutSeconds,
      @Min(0) @Max(10) int maxRetries,
      @Min(0) @Max(86_400) long retryDelaySeconds,
      Boolean enabled,
      String description,
      Map<String, Object> parameters) {

    public StaticJob {
      parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
  }
}
