/*
 * どこで: Tracking サービス層
 * 何を: 開封/クリックを記録し、通知キュー行の集計値を更新する
 * なぜ: ピクセル/リダイレクト応答を記録処理の成否や遅延に左右させないため
 */
package com.matrimony.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.matrimony.notification.config.ExecutorConfig;
import com.matrimony.notification.model.TrackingEvent;
import com.matrimony.notification.model.TrackingEventType;
import com.matrimony.notification.repository.NotificationQueueRepository;
import com.matrimony.notification.repository.TrackingEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class TrackingCollector {

  private static final Logger logger = LoggerFactory.getLogger(TrackingCollector.class);

  private final TrackingEventRepository trackingEventRepository;
  private final NotificationQueueRepository queueRepository;
  private final TransactionTemplate transactionTemplate;
  private final ExecutorService trackingPool;
  private final Clock clock;

  public TrackingCollector(
      TrackingEventRepository trackingEventRepository,
      NotificationQueueRepository queueRepository,
      PlatformTransactionManager transactionManager,
      @Qualifier(ExecutorConfig.TRACKING_POOL) ExecutorService trackingPool,
      Clock clock) {
    this.trackingEventRepository = trackingEventRepository;
    this.queueRepository = queueRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.trackingPool = trackingPool;
    this.clock = clock;
  }

  /** 非同期で開封を記録する。失敗はログに残すだけで呼び出し元へは返さない。 */
  public void recordOpen(UUID trackingId, ClientMetadata client) {
    submit("open", trackingId, () -> recordOpenNow(trackingId, client));
  }

  public void recordClick(
      UUID trackingId, String linkType, String destinationUrl, ClientMetadata client) {
    submit("click", trackingId, () -> recordClickNow(trackingId, linkType, destinationUrl, client));
  }

  /**
   * 同じ (trackingId, マスク済み IP, User-Agent) の開封は 1 回だけ数える。
   *
   * @return 新しい開封として数えた場合 true
   */
  @VisibleForTesting
  boolean recordOpenNow(UUID trackingId, ClientMetadata client) {
    final Instant now = Instant.now(clock);
    final TrackingEvent event =
        new TrackingEvent(
            UUID.randomUUID(),
            trackingId,
            TrackingEventType.OPEN,
            null,
            null,
            IpAddressMasker.mask(client.ipAddress()),
            client.userAgent(),
            client.referer(),
            now);
    final Boolean counted =
        transactionTemplate.execute(
            status -> {
              if (!trackingEventRepository.insertOpenIfAbsent(event)) {
                return false;
              }
              queueRepository.incrementOpenCount(trackingId, now);
              return true;
            });
    if (Boolean.TRUE.equals(counted)) {
      logger.info("notification opened trackingId={}", trackingId);
    }
    return Boolean.TRUE.equals(counted);
  }

  @VisibleForTesting
  void recordClickNow(
      UUID trackingId, String linkType, String destinationUrl, ClientMetadata client) {
    final Instant now = Instant.now(clock);
    final TrackingEvent event =
        new TrackingEvent(
            UUID.randomUUID(),
            trackingId,
            TrackingEventType.CLICK,
            linkType,
            destinationUrl,
            IpAddressMasker.mask(client.ipAddress()),
            client.userAgent(),
            client.referer(),
            now);
    transactionTemplate.executeWithoutResult(
        status -> {
          trackingEventRepository.insertClick(event);
          queueRepository.incrementClickCount(trackingId, now);
        });
    logger.info("notification link clicked trackingId={} linkType={}", trackingId, linkType);
  }

  private void submit(String kind, UUID trackingId, Runnable task) {
    try {
      trackingPool.execute(
          () -> {
            try {
              task.run();
            } catch (RuntimeException ex) {
              logger.warn("failed to record tracking {} trackingId={}", kind, trackingId, ex);
            }
          });
    } catch (RejectedExecutionException ex) {
      logger.warn("tracking {} dropped, executor rejected trackingId={}", kind, trackingId, ex);
    }
  }
}
