package com.matrimony.notification.job;

import com.matrimony.notification.config.NotificationRetentionProperties;
import com.matrimony.notification.model.JobKind;
import com.matrimony.notification.service.NotificationRetentionService;
import com.matrimony.notification.service.RetentionSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationRetentionJobHandler implements JobHandler {

  private final NotificationRetentionService retentionService;
  private final NotificationRetentionProperties properties;

  @Override
  public JobKind kind() {
    return JobKind.NOTIFICATION_RETENTION;
  }

  @Override
  public JobResult handle(JobContext context) {
    final int retentionDays = context.intParameter("retention_days", properties.retentionDays());
    final int trackingRetentionDays =
        context.intParameter("tracking_retention_days", properties.trackingRetentionDays());
    final RetentionSummary summary = retentionService.cleanup(retentionDays, trackingRetentionDays);
    return JobResult.of(
        summary.deletedTotal(),
        summary.deletedTotal(),
        String.format(
            "notifications=%d processedEvents=%d trackingEvents=%d staleActive=%d",
            summary.deletedNotifications(),
            summary.deletedProcessedEvents(),
            summary.deletedTrackingEvents(),
            summary.staleActive()));
  }
}
