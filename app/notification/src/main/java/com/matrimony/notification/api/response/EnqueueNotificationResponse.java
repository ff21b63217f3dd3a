package com.matrimony.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.NotificationStatus;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueNotificationResponse(UUID notificationId, NotificationStatus status) {}
