/*
 * どこで: Tracking サービス層
 * 何を: 通知単位と期間単位の開封/クリック分析値を算出する
 * なぜ: テンプレートや送信時刻の改善判断に使う指標を API で返すため
 */
package com.matrimony.notification.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.TrackingEvent;
import com.matrimony.notification.model.TrackingEventType;
import com.matrimony.notification.repository.NotificationLogRepository;
import com.matrimony.notification.repository.NotificationQueueRepository;
import com.matrimony.notification.repository.TrackingEventRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TrackingAnalyticsService {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ClickDetail(String linkType, String url, Instant timestamp) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record MessageAnalytics(
      UUID trackingId,
      boolean opened,
      int openCount,
      long uniqueOpens,
      Instant firstOpened,
      int clickCount,
      List<ClickDetail> clicks,
      double engagementRate) {

    public MessageAnalytics {
      clicks = clicks == null ? List.of() : List.copyOf(clicks);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record AnalyticsSummary(
      int periodDays,
      long totalEmailsSent,
      long totalOpens,
      long totalClicks,
      long uniqueEmailsOpened,
      double openRate,
      double clickThroughRate,
      double engagementRate) {}

  private final TrackingEventRepository trackingEventRepository;
  private final NotificationQueueRepository queueRepository;
  private final NotificationLogRepository logRepository;
  private final Clock clock;

  public MessageAnalytics messageAnalytics(UUID trackingId) {
    if (queueRepository.findById(trackingId).isEmpty()) {
      throw new NotificationNotFoundException(trackingId);
    }
    final List<TrackingEvent> events = trackingEventRepository.findByTrackingId(trackingId);
    final List<TrackingEvent> opens =
        events.stream().filter(e -> e.eventType() == TrackingEventType.OPEN).toList();
    final List<ClickDetail> clicks =
        events.stream()
            .filter(e -> e.eventType() == TrackingEventType.CLICK)
            .map(e -> new ClickDetail(e.linkType(), e.destinationUrl(), e.occurredAt()))
            .toList();
    final long uniqueOpens = opens.stream().map(TrackingEvent::ipMasked).distinct().count();
    final Instant firstOpened =
        opens.stream().map(TrackingEvent::occurredAt).min(Instant::compareTo).orElse(null);
    final double engagementRate =
        opens.isEmpty() ? 0.0 : percentage(clicks.size(), opens.size());
    return new MessageAnalytics(
        trackingId,
        !opens.isEmpty(),
        opens.size(),
        uniqueOpens,
        firstOpened,
        clicks.size(),
        clicks,
        engagementRate);
  }

  public AnalyticsSummary summary(int days) {
    if (days <= 0) {
      throw new IllegalArgumentException("days must be positive");
    }
    final Instant since = Instant.now(clock).minus(Duration.ofDays(days));
    final TrackingEventRepository.Summary counts = trackingEventRepository.summarizeSince(since);
    final long sent = logRepository.countSentSince(NotificationChannel.EMAIL, since);
    return new AnalyticsSummary(
        days,
        sent,
        counts.opens(),
        counts.clicks(),
        counts.uniqueEmails(),
        percentage(counts.opens(), sent),
        percentage(counts.clicks(), counts.opens()),
        percentage(counts.clicks(), sent));
  }

  // 分母 0 は 1 として扱い、小数第 2 位で丸めた百分率を返す
  static double percentage(long numerator, long denominator) {
    return BigDecimal.valueOf(numerator * 100L)
        .divide(BigDecimal.valueOf(Math.max(denominator, 1L)), 2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
