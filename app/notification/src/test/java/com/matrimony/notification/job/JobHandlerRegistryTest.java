package com.matrimony.notification.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.matrimony.notification.model.JobKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobHandlerRegistryTest {

  @Test
  void resolvesHandlerByKind() {
    final List<JobHandler> handlers = allKinds();

    final JobHandlerRegistry registry = new JobHandlerRegistry(handlers);

    assertThat(registry.handlerFor(JobKind.NOTIFICATION_RETENTION).kind())
        .isEqualTo(JobKind.NOTIFICATION_RETENTION);
  }

  @Test
  void missingKindFailsAtStartup() {
    final List<JobHandler> handlers = allKinds();
    handlers.remove(0);

    assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("no job handler");
  }

  @Test
  void duplicateKindFailsAtStartup() {
    final List<JobHandler> handlers = allKinds();
    handlers.add(handler(JobKind.NOTIFICATION_DISPATCH));

    assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate");
  }

  private static List<JobHandler> allKinds() {
    final List<JobHandler> handlers = new ArrayList<>();
    for (JobKind kind : JobKind.values()) {
      handlers.add(handler(kind));
    }
    return handlers;
  }

  private static JobHandler handler(JobKind kind) {
    return new JobHandler() {
      @Override
      public JobKind kind() {
        return kind;
      }

      @Override
      public JobResult handle(JobContext context) {
        return JobResult.of(0, 0, null);
      }
    };
  }
}
