/*
 * どこで: Notification デバッグ API
 * 何を: 受信者ごとの通知キュー行を新しい順に返す
 * なぜ: 動作確認と開発時の可視化のため
 */
package com.matrimony.notification.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matrimony.notification.api.response.NotificationInboxResponse;
import com.matrimony.notification.api.response.NotificationSummary;
import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.repository.NotificationQueueRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

  private static final int MAX_LIMIT = 200;

  private final NotificationQueueRepository queueRepository;
  private final ObjectMapper objectMapper;

  @GetMapping("/inbox/{recipientId}")
  public NotificationInboxResponse inbox(
      @PathVariable("recipientId") String recipientId,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    final List<NotificationSummary> items =
        queueRepository.findByRecipientId(recipientId, limit).stream()
            .map(this::toSummary)
            .toList();
    return new NotificationInboxResponse(recipientId, items);
  }

  private NotificationSummary toSummary(NotificationQueueItem item) {
    final JsonNode templateData;
    try {
      templateData =
          item.templateDataJson() == null
              ? objectMapper.createObjectNode()
              : objectMapper.readTree(item.templateDataJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification template data parse failure", ex);
    }
    return new NotificationSummary(
        item.notificationId(),
        item.eventId(),
        item.parentId(),
        item.trigger(),
        item.priority(),
        item.channels(),
        item.status(),
        item.attempts(),
        item.scheduledFor(),
        item.lastError(),
        item.openCount(),
        item.clickCount(),
        item.createdAt(),
        item.completedAt(),
        templateData);
  }
}
