/*
 * どこで: Notification API
 * 何を: 通知依頼を受け付けてキューへ積む
 * なぜ: 依頼元が配信完了を待たずに 202 で戻れるようにするため
 */
package com.matrimony.notification.api;

import com.matrimony.notification.api.request.EnqueueNotificationRequest;
import com.matrimony.notification.api.response.EnqueueNotificationResponse;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.model.NotificationStatus;
import com.matrimony.notification.service.EnqueueNotificationCommand;
import com.matrimony.notification.service.NotificationQueueService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationQueueService queueService;

  @PostMapping
  public ResponseEntity<EnqueueNotificationResponse> enqueue(
      @Valid @RequestBody EnqueueNotificationRequest request) {
    final EnqueueNotificationCommand command =
        new EnqueueNotificationCommand(
            request.eventId(),
            request.recipientId(),
            request.trigger(),
            request.channels().stream().map(NotificationChannel::fromValue).toList(),
            NotificationPriority.fromValue(request.priority()),
            request.templateData(),
            request.scheduledFor());
    final UUID notificationId = queueService.enqueue(command);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new EnqueueNotificationResponse(notificationId, NotificationStatus.PENDING));
  }
}
