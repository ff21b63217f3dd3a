/*
 * どこで: Notification サービス層
 * 何を: 受信者の配信設定 (チャネル opt-in / レート制限 / 静穏時間帯) を enqueue 前に適用する
 * なぜ: 受信者が望まない通知や送りすぎを queue に積む前に止めるため
 */
package com.matrimony.notification.service;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPreferences;
import com.matrimony.notification.model.NotificationPreferences.QuietHours;
import com.matrimony.notification.model.NotificationPreferences.RateLimit;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.repository.NotificationLogRepository;
import com.matrimony.notification.repository.NotificationPreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPreferenceService.class);

  private final NotificationPreferenceRepository preferenceRepository;
  private final NotificationLogRepository logRepository;
  private final Clock clock;

  public NotificationPreferences get(String recipientId) {
    return preferenceRepository
        .findByRecipientId(recipientId)
        .orElseGet(() -> NotificationPreferences.unrestricted(recipientId));
  }

  public NotificationPreferences save(NotificationPreferences preferences) {
    preferenceRepository.upsert(preferences, Instant.now(clock));
    logger.info("notification preferences updated recipientId={}", preferences.recipientId());
    return preferences;
  }

  /**
   * 設定行の無い受信者には何も適用しない。
   *
   * @throws NotificationSuppressedException 残るチャネルが無い場合
   */
  public DeliveryPlan plan(
      String recipientId,
      String trigger,
      List<NotificationChannel> channels,
      NotificationPriority priority,
      Instant scheduledFor) {
    final Instant now = Instant.now(clock);
    final Instant sendAt = scheduledFor == null ? now : scheduledFor;
    final Optional<NotificationPreferences> stored = preferenceRepository.findByRecipientId(recipientId);
    if (stored.isEmpty()) {
      return new DeliveryPlan(channels, sendAt);
    }
    final NotificationPreferences preferences = stored.get();

    final List<NotificationChannel> optedIn = filterOptedIn(preferences, trigger, channels);
    if (optedIn.isEmpty()) {
      throw new NotificationSuppressedException(
          NotificationSuppressedException.Reason.OPTED_OUT,
          "recipient has disabled " + trigger + " notifications");
    }

    final List<NotificationChannel> allowed = new ArrayList<>();
    for (NotificationChannel channel : optedIn) {
      if (withinRateLimit(recipientId, channel, preferences.rateLimits().get(channel), now)) {
        allowed.add(channel);
      } else {
        logger.info(
            "channel skipped by rate limit recipientId={} trigger={} channel={}",
            recipientId,
            trigger,
            channel);
      }
    }
    if (allowed.isEmpty()) {
      throw new NotificationSuppressedException(
          NotificationSuppressedException.Reason.RATE_LIMITED, "rate limit exceeded");
    }

    return new DeliveryPlan(allowed, applyQuietHours(preferences.quietHours(), trigger, priority, sendAt));
  }

  private static List<NotificationChannel> filterOptedIn(
      NotificationPreferences preferences, String trigger, List<NotificationChannel> channels) {
    return preferences
        .allowedChannels(trigger)
        .map(enabled -> channels.stream().filter(enabled::contains).toList())
        .orElse(channels);
  }

  private boolean withinRateLimit(
      String recipientId, NotificationChannel channel, RateLimit limit, Instant now) {
    if (limit == null) {
      return true;
    }
    final Instant since = now.minus(limit.period().window());
    return logRepository.countSentToRecipientSince(recipientId, channel, since) < limit.max();
  }

  private static Instant applyQuietHours(
      QuietHours quietHours, String trigger, NotificationPriority priority, Instant sendAt) {
    // CRITICAL と例外トリガーは静穏時間帯でも送る
    if (priority == NotificationPriority.CRITICAL || quietHours.exceptions().contains(trigger)) {
      return sendAt;
    }
    return quietHours.deferUntil(sendAt).orElse(sendAt);
  }
}
