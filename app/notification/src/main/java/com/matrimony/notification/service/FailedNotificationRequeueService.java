/*
 * どこで: Notification サービス層
 * 何を: lookback 内に FAILED になった (DLQ 外の) item から派生コピーを PENDING で作る
 * なぜ: provider 障害などで一括失敗した通知を、元の行を書き換えずに再送するため
 */
package com.matrimony.notification.service;

import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.repository.NotificationQueueRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FailedNotificationRequeueService {

  private static final Logger logger =
      LoggerFactory.getLogger(FailedNotificationRequeueService.class);

  private final NotificationQueueRepository queueRepository;
  private final Clock clock;

  /**
   * @return 新たに PENDING で作った派生 item の件数
   */
  public int requeue(Duration lookback, int limit) {
    if (lookback.isNegative() || lookback.isZero() || limit <= 0) {
      throw new IllegalArgumentException("lookback and limit must be positive");
    }
    final Instant now = Instant.now(clock);
    final List<NotificationQueueItem> candidates =
        queueRepository.findRequeueCandidates(now.minus(lookback), limit);
    int requeued = 0;
    for (NotificationQueueItem original : candidates) {
      final NotificationQueueItem copy =
          NotificationQueueItem.pending(
              UUID.randomUUID(),
              original.eventId(),
              original.notificationId(),
              original.recipientId(),
              original.trigger(),
              original.priority(),
              original.channels(),
              original.templateDataJson(),
              now,
              now);
      try {
        queueRepository.insert(copy);
        requeued++;
        logger.info(
            "failed notification requeued originalId={} newId={}",
            original.notificationId(),
            copy.notificationId());
      } catch (DuplicateKeyException ex) {
        // 別インスタンスが先に再投入済み
        logger.info(
            "failed notification already requeued originalId={}", original.notificationId());
      }
    }
    logger.info(
        "failed notification requeue finished candidates={} requeued={} lookback={}",
        candidates.size(),
        requeued,
        lookback);
    return requeued;
  }
}
