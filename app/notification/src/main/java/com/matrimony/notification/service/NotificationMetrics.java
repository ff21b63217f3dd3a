/*
 * どこで: Notification サービス層
 * 何を: チャネル別配信結果/item 結果/E2E 遅延/backlog/DLQ のメトリクスを記録する
 * なぜ: 配信パスの健全性を Prometheus から直接観測できるようにするため
 */
package com.matrimony.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_DISPATCH_ITEMS = "notification.dispatch.items";
  private static final String METRIC_DELIVERY_E2E_DELAY = "notification.delivery.e2e.delay";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";
  private static final String METRIC_DLQ_TOTAL = "notification.dlq.total";

  private final MeterRegistry meterRegistry;
  private final AtomicLong backlogCurrent = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter dlqCounter;
  private final Timer deliveryE2eDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicLong::get)
        .description("Pending notifications whose scheduled time has passed")
        .register(meterRegistry);
    this.dlqCounter =
        Counter.builder(METRIC_DLQ_TOTAL)
            .description("Total number of notifications moved to DLQ")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("Delay from enqueue to successful delivery")
            .register(meterRegistry);
  }

  public void recordChannelResult(String channel, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Notification channel delivery outcomes",
            Tags.of("channel", channel, "result", result))
        .increment();
  }

  public void recordItemResult(String result) {
    counter(METRIC_DISPATCH_ITEMS, "Dispatch pass item outcomes", Tags.of("result", result))
        .increment();
  }

  public void recordDeliveryE2eDelay(Instant enqueuedAt, Instant sentAt) {
    if (enqueuedAt == null || sentAt == null || sentAt.isBefore(enqueuedAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(enqueuedAt, sentAt));
  }

  public void recordDlqMoved() {
    dlqCounter.increment();
  }

  public void updateBacklogCurrent(long backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
