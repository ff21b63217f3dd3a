package com.matrimony.notification.job;

import com.matrimony.notification.config.NotificationRetentionProperties;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.service.FailedNotificationRequeueService;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FailedNotificationRequeueJobHandler implements JobHandler {

  private final FailedNotificationRequeueService requeueService;
  private final NotificationRetentionProperties properties;

  @Override
  public JobKind kind() {
    return JobKind.FAILED_NOTIFICATION_REQUEUE;
  }

  @Override
  public JobResult handle(JobContext context) {
    final long lookbackHours =
        context.longParameter("lookback_hours", properties.requeueLookbackHours());
    final int batchSize = context.intParameter("batch_size", properties.requeueBatchSize());
    final int requeued = requeueService.requeue(Duration.ofHours(lookbackHours), batchSize);
    return JobResult.of(requeued, requeued, "requeued=" + requeued);
  }
}
