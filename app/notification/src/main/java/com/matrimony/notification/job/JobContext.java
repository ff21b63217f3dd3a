/*
 * どこで: Scheduler ジョブ実行
 * 何を: ハンドラへ渡す実行時情報 (定義・パラメータ・試行番号)
 * なぜ: ハンドラが DB の定義行や JSON を直接扱わずに済むようにするため
 */
package com.matrimony.notification.job;

import com.matrimony.notification.model.JobDefinition;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record JobContext(
    JobDefinition job,
    Map<String, Object> parameters,
    UUID executionId,
    int attempt,
    String triggeredBy,
    Instant startedAt) {

  public JobContext {
    parameters = parameters == null ? Map.of() : parameters;
  }

  /** 数値パラメータを読む。未指定なら defaultValue、数値でなければ IllegalArgumentException。 */
  public int intParameter(String name, int defaultValue) {
    return (int) longParameter(name, defaultValue);
  }

  public long longParameter(String name, long defaultValue) {
    final Object value = parameters.get(name);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("parameter " + name + " must be a number: " + value, ex);
    }
  }
}
