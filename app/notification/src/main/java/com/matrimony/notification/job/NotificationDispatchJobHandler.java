package com.matrimony.notification.job;

import com.matrimony.notification.config.NotificationDeliveryProperties;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.service.DispatchSummary;
import com.matrimony.notification.service.NotificationDispatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 1 回の dispatch pass。パラメータ batch_size で claim 件数を上書きできる。 */
@Component
@RequiredArgsConstructor
public class NotificationDispatchJobHandler implements JobHandler {

  private final NotificationDispatchService dispatchService;
  private final NotificationDeliveryProperties properties;

  @Override
  public JobKind kind() {
    return JobKind.NOTIFICATION_DISPATCH;
  }

  @Override
  public JobResult handle(JobContext context) {
    final int batchSize = context.intParameter("batch_size", properties.batchSize());
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batch_size must be positive");
    }
    final DispatchSummary summary = dispatchService.dispatchPass(batchSize);
    return JobResult.of(
        summary.claimed(),
        summary.affected(),
        String.format(
            "sent=%d failed=%d skipped=%d retried=%d poisoned=%d lost=%d",
            summary.sent(),
            summary.failed(),
            summary.skipped(),
            summary.retried(),
            summary.poisoned(),
            summary.lost()));
  }
}
