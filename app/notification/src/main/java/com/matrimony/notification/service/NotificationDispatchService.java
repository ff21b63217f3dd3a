/*
 * どこで: Notification サービス層
 * 何を: 期限到来の queue item を claim し、チャネルごとに描画して送信し、結果を確定する
 * なぜ: 通知の最終状態 (SENT/FAILED/SKIPPED) と再試行/DLQ をここで一元制御するため
 */
package com.matrimony.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.matrimony.common.HostNames;
import com.matrimony.notification.channel.ChannelAdapter;
import com.matrimony.notification.channel.ChannelAdapterRegistry;
import com.matrimony.notification.channel.ChannelMessage;
import com.matrimony.notification.channel.ChannelSendResult;
import com.matrimony.notification.channel.FailureKind;
import com.matrimony.notification.config.ExecutorConfig;
import com.matrimony.notification.config.NotificationDeliveryProperties;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationLogEntry;
import com.matrimony.notification.model.NotificationQueueItem;
import com.matrimony.notification.model.NotificationStatus;
import com.matrimony.notification.model.NotificationTemplate;
import com.matrimony.notification.repository.NotificationDlqRepository;
import com.matrimony.notification.repository.NotificationLogRepository;
import com.matrimony.notification.repository.NotificationQueueRepository;
import com.matrimony.notification.repository.NotificationTemplateRepository;
import com.matrimony.notification.template.RenderedText;
import com.matrimony.notification.template.TemplateRenderer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class NotificationDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);
  private static final TypeReference<Map<String, Object>> TEMPLATE_DATA_TYPE =
      new TypeReference<>() {};
  private static final int PREVIEW_LENGTH = 100;
  private static final String TRACKING_KEY = "tracking";

  private final NotificationQueueRepository queueRepository;
  private final NotificationTemplateRepository templateRepository;
  private final NotificationLogRepository logRepository;
  private final NotificationDlqRepository dlqRepository;
  private final ChannelAdapterRegistry adapterRegistry;
  private final TemplateRenderer renderer;
  private final TrackingLinkBuilder trackingLinkBuilder;
  private final NotificationMetrics metrics;
  private final NotificationDeliveryProperties properties;
  private final ObjectMapper objectMapper;
  private final TransactionTemplate transactionTemplate;
  private final ExecutorService itemPool;
  private final ExecutorService channelPool;
  private final Clock clock;

  public NotificationDispatchService(
      NotificationQueueRepository queueRepository,
      NotificationTemplateRepository templateRepository,
      NotificationLogRepository logRepository,
      NotificationDlqRepository dlqRepository,
      ChannelAdapterRegistry adapterRegistry,
      TemplateRenderer renderer,
      TrackingLinkBuilder trackingLinkBuilder,
      NotificationMetrics metrics,
      NotificationDeliveryProperties properties,
      ObjectMapper objectMapper,
      PlatformTransactionManager transactionManager,
      @Qualifier(ExecutorConfig.DISPATCH_ITEM_POOL) ExecutorService itemPool,
      @Qualifier(ExecutorConfig.CHANNEL_SEND_POOL) ExecutorService channelPool,
      Clock clock) {
    this.queueRepository = queueRepository;
    this.templateRepository = templateRepository;
    this.logRepository = logRepository;
    this.dlqRepository = dlqRepository;
    this.adapterRegistry = adapterRegistry;
    this.renderer = renderer;
    this.trackingLinkBuilder = trackingLinkBuilder;
    this.metrics = metrics;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.itemPool = itemPool;
    this.channelPool = channelPool;
    this.clock = clock;
  }

  public DispatchSummary dispatchPass(int batchLimit) {
    final Instant now = Instant.now(clock);
    final String claimToken = HostNames.resolve() + ":" + UUID.randomUUID();
    // claim を単一 SQL で行い、送信 IO を長期トランザクションに載せない
    final List<NotificationQueueItem> claimed =
        queueRepository.claimDue(batchLimit, now, now.plus(properties.lease()), claimToken);
    if (claimed.isEmpty()) {
      refreshBacklog();
      return DispatchSummary.empty();
    }

    final List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(claimed.size());
    for (NotificationQueueItem item : claimed) {
      futures.add(
          CompletableFuture.supplyAsync(() -> processItemSafely(item, claimToken), itemPool));
    }
    final Map<ItemOutcome, Integer> counts = new EnumMap<>(ItemOutcome.class);
    for (CompletableFuture<ItemOutcome> future : futures) {
      final ItemOutcome outcome = future.join();
      counts.merge(outcome, 1, Integer::sum);
      metrics.recordItemResult(outcome.tag());
    }
    refreshBacklog();

    final DispatchSummary summary =
        new DispatchSummary(
            claimed.size(),
            counts.getOrDefault(ItemOutcome.SENT, 0),
            counts.getOrDefault(ItemOutcome.FAILED, 0),
            counts.getOrDefault(ItemOutcome.SKIPPED, 0),
            counts.getOrDefault(ItemOutcome.RETRIED, 0),
            counts.getOrDefault(ItemOutcome.POISONED, 0),
            counts.getOrDefault(ItemOutcome.LOST, 0));
    logger.info(
        "dispatch pass finished claimed={} sent={} failed={} skipped={} retried={} poisoned={} lost={}",
        summary.claimed(),
        summary.sent(),
        summary.failed(),
        summary.skipped(),
        summary.retried(),
        summary.poisoned(),
        summary.lost());
    return summary;
  }

  private ItemOutcome processItemSafely(NotificationQueueItem item, String claimToken) {
    try {
      return processItem(item, claimToken);
    } catch (RuntimeException ex) {
      logger.warn(
          "notification dispatch aborted id={} attempts={}",
          item.notificationId(),
          item.attempts(),
          ex);
      return recordAbortedAttempt(item, claimToken, ex);
    }
  }

  /** 中断した試行も attempts に数え、PROCESSING のまま放置して同じ送信を繰り返さないようにする。 */
  private ItemOutcome recordAbortedAttempt(
      NotificationQueueItem item, String claimToken, RuntimeException cause) {
    final int attempts = item.attempts() + 1;
    final String error = "dispatch aborted: " + cause.getClass().getSimpleName();
    try {
      if (attempts >= properties.maxAttempts()) {
        return poison(item, claimToken, attempts, error, List.of());
      }
      return release(item, claimToken, attempts, error, Instant.now(clock));
    } catch (RuntimeException ex) {
      // 書き戻しも失敗した場合は lease 切れ後に再 claim される
      logger.error(
          "failed to record aborted dispatch; left for lease expiry id={}",
          item.notificationId(),
          ex);
      return ItemOutcome.LOST;
    }
  }

  @VisibleForTesting
  ItemOutcome processItem(NotificationQueueItem item, String claimToken) {
    final int maxAttempts = properties.maxAttempts();
    if (item.attempts() >= maxAttempts) {
      // 既に試行回数を使い切った item は送らずに DLQ へ
      return poison(item, claimToken, item.attempts(), "max attempts exhausted", List.of());
    }
    final int attempts = item.attempts() + 1;

    final Map<String, Object> data;
    try {
      data = readTemplateData(item);
    } catch (JsonProcessingException ex) {
      return finishFailed(item, claimToken, attempts, "unreadable template data", List.of());
    }

    final List<ChannelAttempt> channelAttempts = sendAllChannels(item, data);
    final Instant now = Instant.now(clock);
    for (ChannelAttempt attempt : channelAttempts) {
      metrics.recordChannelResult(attempt.channel().value(), attempt.resultTag());
    }

    final boolean anySent = channelAttempts.stream().anyMatch(ChannelAttempt::sent);
    final boolean allSkipped = channelAttempts.stream().allMatch(ChannelAttempt::skipped);
    if (anySent) {
      final ItemOutcome outcome =
          finishTerminal(item, claimToken, NotificationStatus.SENT, attempts, null, channelAttempts);
      if (outcome == ItemOutcome.SENT) {
        metrics.recordDeliveryE2eDelay(item.createdAt(), now);
      }
      return outcome;
    }
    if (allSkipped) {
      return finishTerminal(
          item, claimToken, NotificationStatus.SKIPPED, attempts, null, channelAttempts);
    }

    final String error = summarizeErrors(channelAttempts);
    final boolean anyTransient =
        channelAttempts.stream().anyMatch(a -> a.result() != null && a.result().isTransientFailure());
    if (anyTransient && attempts < maxAttempts) {
      return release(item, claimToken, attempts, error, now);
    }
    if (attempts >= maxAttempts) {
      return poison(item, claimToken, attempts, error, channelAttempts);
    }
    return finishFailed(item, claimToken, attempts, error, channelAttempts);
  }

  private List<ChannelAttempt> sendAllChannels(
      NotificationQueueItem item, Map<String, Object> data) {
    final List<CompletableFuture<ChannelAttempt>> futures = new ArrayList<>();
    for (NotificationChannel channel : item.channels()) {
      futures.add(
          CompletableFuture.supplyAsync(() -> sendChannel(item, channel, data), channelPool));
    }
    final List<ChannelAttempt> attempts = new ArrayList<>(futures.size());
    for (CompletableFuture<ChannelAttempt> future : futures) {
      try {
        attempts.add(future.join());
      } catch (CompletionException ex) {
        // アダプタ外 (テンプレート取得など) の例外は item 全体を中断させる
        throw ex.getCause() instanceof RuntimeException runtime ? runtime : ex;
      }
    }
    return attempts;
  }

  private ChannelAttempt sendChannel(
      NotificationQueueItem item, NotificationChannel channel, Map<String, Object> data) {
    try {
      return renderAndSend(item, channel, data);
    } catch (RuntimeException ex) {
      // 1 チャネルの障害で送信済みの他チャネルの結果を失わない
      logger.warn(
          "channel dispatch failed id={} channel={}",
          item.notificationId(),
          channel.value(),
          ex);
      return ChannelAttempt.attempted(
          channel,
          null,
          null,
          ChannelSendResult.failed(
              FailureKind.TRANSIENT, "channel processing failed: " + ex.getClass().getSimpleName()));
    }
  }

  private ChannelAttempt renderAndSend(
      NotificationQueueItem item, NotificationChannel channel, Map<String, Object> data) {
    final Optional<NotificationTemplate> template =
        templateRepository.findActive(item.trigger(), channel);
    if (template.isEmpty()) {
      logger.info(
          "no active template; channel skipped id={} trigger={} channel={}",
          item.notificationId(),
          item.trigger(),
          channel.value());
      return ChannelAttempt.skipped(channel);
    }
    final Map<String, Object> channelData = new HashMap<>(data);
    if (channel == NotificationChannel.EMAIL) {
      channelData.put(TRACKING_KEY, trackingLinkBuilder.templateData(item.notificationId()));
    }
    final RenderedText subject = renderer.render(template.get().subject(), channelData);
    final RenderedText body = renderer.render(template.get().body(), channelData);
    if (!subject.fullyResolved() || !body.fullyResolved()) {
      logger.warn(
          "template rendered with unresolved placeholders id={} channel={} subject={} body={}",
          item.notificationId(),
          channel.value(),
          subject.unresolvedPlaceholders(),
          body.unresolvedPlaceholders());
    }
    final String text = finishBody(item, channel, template.get(), body.text());

    final Optional<ChannelAdapter> adapter = adapterRegistry.adapterFor(channel);
    if (adapter.isEmpty()) {
      return ChannelAttempt.attempted(
          channel,
          subject.text(),
          text,
          ChannelSendResult.failed(FailureKind.PERMANENT, "no adapter for channel " + channel.value()));
    }
    final ChannelMessage message =
        new ChannelMessage(
            item.notificationId(),
            item.recipientId(),
            channel,
            item.trigger(),
            item.priority(),
            subject.text(),
            text);
    return ChannelAttempt.attempted(channel, subject.text(), text, adapter.get().send(message));
  }

  private String finishBody(
      NotificationQueueItem item,
      NotificationChannel channel,
      NotificationTemplate template,
      String body) {
    if (channel == NotificationChannel.EMAIL && trackingLinkBuilder.appendPixel()) {
      return body + trackingLinkBuilder.pixelTag(item.notificationId());
    }
    final Integer maxLength = template.maxLength();
    if (channel == NotificationChannel.SMS && maxLength != null && body.length() > maxLength) {
      return body.substring(0, maxLength);
    }
    return body;
  }

  private ItemOutcome release(
      NotificationQueueItem item, String claimToken, int attempts, String error, Instant now) {
    final Duration backoff = computeBackoffDuration(attempts);
    final Instant nextScheduledFor = now.plus(backoff);
    final int updated =
        queueRepository.release(
            item.notificationId(), claimToken, attempts, nextScheduledFor, truncateError(error), now);
    if (updated == 0) {
      logger.warn(
          "notification retry skipped because claim was lost id={} attempt={}",
          item.notificationId(),
          attempts);
      return ItemOutcome.LOST;
    }
    logger.warn(
        "notification retry scheduled id={} attempt={} nextScheduledFor={} error={}",
        item.notificationId(),
        attempts,
        nextScheduledFor,
        error);
    return ItemOutcome.RETRIED;
  }

  private ItemOutcome finishFailed(
      NotificationQueueItem item,
      String claimToken,
      int attempts,
      String error,
      List<ChannelAttempt> channelAttempts) {
    final ItemOutcome outcome =
        finishTerminal(
            item, claimToken, NotificationStatus.FAILED, attempts, error, channelAttempts);
    if (outcome == ItemOutcome.FAILED) {
      logger.warn(
          "notification failed permanently id={} attempts={} error={}",
          item.notificationId(),
          attempts,
          error);
    }
    return outcome;
  }

  private ItemOutcome finishTerminal(
      NotificationQueueItem item,
      String claimToken,
      NotificationStatus status,
      int attempts,
      String error,
      List<ChannelAttempt> channelAttempts) {
    final Instant now = Instant.now(clock);
    // 状態更新とログ行を同一トランザクションにまとめ、claim 喪失時はログも残さない
    final Boolean completed =
        transactionTemplate.execute(
            tx -> {
              final int count =
                  queueRepository.complete(
                      item.notificationId(), claimToken, status, attempts, truncateError(error), now);
              if (count == 0) {
                tx.setRollbackOnly();
                return false;
              }
              logRepository.insertAll(toLogEntries(item, channelAttempts, now));
              return true;
            });
    if (!Boolean.TRUE.equals(completed)) {
      logger.warn(
          "notification {} skipped because claim was lost id={}", status, item.notificationId());
      return ItemOutcome.LOST;
    }
    return switch (status) {
      case SENT -> ItemOutcome.SENT;
      case SKIPPED -> ItemOutcome.SKIPPED;
      default -> ItemOutcome.FAILED;
    };
  }

  private ItemOutcome poison(
      NotificationQueueItem item,
      String claimToken,
      int attempts,
      String error,
      List<ChannelAttempt> channelAttempts) {
    final Instant now = Instant.now(clock);
    final String truncated = truncateError(error);
    // DLQ 登録と FAILED 更新を同一トランザクションにまとめ、ロック喪失時の不整合を避ける
    final Boolean moved =
        transactionTemplate.execute(
            tx -> {
              dlqRepository.insert(
                  UUID.randomUUID(),
                  item.notificationId(),
                  item.eventId(),
                  item.templateDataJson(),
                  truncated,
                  now);
              final int count =
                  queueRepository.complete(
                      item.notificationId(),
                      claimToken,
                      NotificationStatus.FAILED,
                      attempts,
                      truncated,
                      now);
              if (count == 0) {
                tx.setRollbackOnly();
                return false;
              }
              logRepository.insertAll(toLogEntries(item, channelAttempts, now));
              return true;
            });
    if (!Boolean.TRUE.equals(moved)) {
      logger.warn(
          "notification dlq skipped because claim was lost id={} eventId={}",
          item.notificationId(),
          item.eventId());
      return ItemOutcome.LOST;
    }
    metrics.recordDlqMoved();
    logger.warn(
        "notification moved to DLQ id={} eventId={} attempts={} error={}",
        item.notificationId(),
        item.eventId(),
        attempts,
        truncated);
    return ItemOutcome.POISONED;
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  private Map<String, Object> readTemplateData(NotificationQueueItem item)
      throws JsonProcessingException {
    if (item.templateDataJson() == null || item.templateDataJson().isBlank()) {
      return Map.of();
    }
    final Map<String, Object> data =
        objectMapper.readValue(item.templateDataJson(), TEMPLATE_DATA_TYPE);
    return data == null ? Map.of() : data;
  }

  private List<NotificationLogEntry> toLogEntries(
      NotificationQueueItem item, List<ChannelAttempt> channelAttempts, Instant now) {
    final List<NotificationLogEntry> entries = new ArrayList<>(channelAttempts.size());
    for (ChannelAttempt attempt : channelAttempts) {
      final ChannelSendResult result = attempt.result();
      entries.add(
          new NotificationLogEntry(
              UUID.randomUUID(),
              item.notificationId(),
              item.recipientId(),
              item.trigger(),
              attempt.channel(),
              item.priority(),
              attempt.status(),
              result == null ? null : result.providerUsed(),
              attempt.subject(),
              preview(attempt.body()),
              result == null ? 0 : result.deliveredCount(),
              result == null ? 0 : result.failedCount(),
              result == null ? null : truncateError(result.error()),
              now));
    }
    return entries;
  }

  private static String summarizeErrors(List<ChannelAttempt> channelAttempts) {
    final StringBuilder out = new StringBuilder();
    for (ChannelAttempt attempt : channelAttempts) {
      if (attempt.result() == null || attempt.result().success()) {
        continue;
      }
      if (out.length() > 0) {
        out.append("; ");
      }
      out.append(attempt.channel().value()).append(": ").append(attempt.result().error());
    }
    return out.toString();
  }

  private static String preview(String body) {
    if (body == null) {
      return null;
    }
    return body.length() <= PREVIEW_LENGTH ? body : body.substring(0, PREVIEW_LENGTH);
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private void refreshBacklog() {
    try {
      metrics.updateBacklogCurrent(queueRepository.countBacklog(Instant.now(clock)));
    } catch (RuntimeException ex) {
      logger.warn("failed to refresh notification backlog gauge", ex);
    }
  }

  /** チャネル 1 つ分の試行結果。テンプレートが無かった場合は result が null。 */
  private record ChannelAttempt(
      NotificationChannel channel, String subject, String body, ChannelSendResult result) {

    static ChannelAttempt skipped(NotificationChannel channel) {
      return new ChannelAttempt(channel, null, null, null);
    }

    static ChannelAttempt attempted(
        NotificationChannel channel, String subject, String body, ChannelSendResult result) {
      return new ChannelAttempt(channel, subject, body, result);
    }

    boolean skipped() {
      return result == null;
    }

    boolean sent() {
      return result != null && result.success();
    }

    NotificationStatus status() {
      if (skipped()) {
        return NotificationStatus.SKIPPED;
      }
      return result.success() ? NotificationStatus.SENT : NotificationStatus.FAILED;
    }

    String resultTag() {
      return switch (status()) {
        case SENT -> "sent";
        case SKIPPED -> "skipped";
        default -> result.isTransientFailure() ? "transient_failure" : "permanent_failure";
      };
    }
  }
}
