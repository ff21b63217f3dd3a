/*
 * Where: Notification application configuration binding
 * What: Holds default retention windows for the maintenance jobs
 * Why: Job parameters may override them, but an unparameterised job still needs sane values
 */
package com.matrimony.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.retention")
public record NotificationRetentionProperties(
                int retentionDays,
                int trackingRetentionDays,
                int executionHistoryDays,
                int requeueLookbackHours,
                int requeueBatchSize) {
}
