/*
 * どこで: Scheduler ジョブ実行
 * 何を: JobKind からハンドラを引く表を起動時に組み立てる
 * なぜ: ハンドラの欠落/重複を実行時ではなく起動時に検出するため
 */
package com.matrimony.notification.job;

import com.matrimony.notification.model.JobKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class JobHandlerRegistry {

  private final Map<JobKind, JobHandler> handlers = new EnumMap<>(JobKind.class);

  public JobHandlerRegistry(List<JobHandler> handlers) {
    for (JobHandler handler : handlers) {
      if (this.handlers.putIfAbsent(handler.kind(), handler) != null) {
        throw new IllegalStateException("duplicate job handler: " + handler.kind());
      }
    }
    for (JobKind kind : JobKind.values()) {
      if (!this.handlers.containsKey(kind)) {
        throw new IllegalStateException("no job handler for kind: " + kind);
      }
    }
  }

  public JobHandler handlerFor(JobKind kind) {
    final JobHandler handler = handlers.get(kind);
    if (handler == null) {
      throw new IllegalArgumentException("no job handler for kind: " + kind);
    }
    return handler;
  }
}
