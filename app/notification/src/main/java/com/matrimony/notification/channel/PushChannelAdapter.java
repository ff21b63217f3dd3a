/*
 * どこで: Notification チャネル
 * 何を: recipient の有効なデバイストークン全件へ push を送る
 * なぜ: 1 台でも届けば通知は成立し、無効トークンは次回以降の送信先から外すため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.ChannelSubscription;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.repository.ChannelSubscriptionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PushChannelAdapter implements ChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(PushChannelAdapter.class);

  private final List<DeliveryProvider> providers;
  private final ChannelSubscriptionRepository subscriptionRepository;
  private final Clock clock;

  public PushChannelAdapter(
      List<DeliveryProvider> providers,
      ChannelSubscriptionRepository subscriptionRepository,
      Clock clock) {
    this.providers = List.copyOf(providers);
    this.subscriptionRepository = subscriptionRepository;
    this.clock = clock;
  }

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.PUSH;
  }

  @Override
  public ChannelSendResult send(ChannelMessage message) {
    if (providers.isEmpty()) {
      return ChannelSendResult.failed(FailureKind.PERMANENT, "no push provider configured");
    }
    final List<ChannelSubscription> subscriptions;
    try {
      subscriptions = subscriptionRepository.findActiveByRecipientId(message.recipientId());
    } catch (RuntimeException ex) {
      logger.warn("push subscription lookup failed recipientId={}", message.recipientId(), ex);
      return ChannelSendResult.failed(FailureKind.TRANSIENT, "subscription lookup failed");
    }
    if (subscriptions.isEmpty()) {
      return ChannelSendResult.failed(FailureKind.PERMANENT, "no active push subscription");
    }
    int delivered = 0;
    int failed = 0;
    boolean anyTransient = false;
    String providerUsed = null;
    String lastError = null;
    for (ChannelSubscription subscription : subscriptions) {
      final TokenOutcome outcome = sendToToken(message, subscription.deviceToken());
      if (outcome.providerUsed() != null) {
        delivered++;
        providerUsed = providerUsed == null ? outcome.providerUsed() : providerUsed;
        continue;
      }
      failed++;
      anyTransient |= outcome.transientFailure();
      lastError = outcome.error();
      if (outcome.invalidToken()) {
        deactivate(subscription.deviceToken());
      }
    }
    if (delivered > 0) {
      return ChannelSendResult.delivered(providerUsed, delivered, failed);
    }
    return ChannelSendResult.failed(
        anyTransient ? FailureKind.TRANSIENT : FailureKind.PERMANENT, lastError, failed);
  }

  private TokenOutcome sendToToken(ChannelMessage message, String deviceToken) {
    final DeliveryRequest request =
        new DeliveryRequest(
            message.notificationId(),
            message.recipientId(),
            NotificationChannel.PUSH,
            deviceToken,
            message.subject(),
            message.body());
    boolean anyTransient = false;
    boolean invalidToken = false;
    String lastError = null;
    for (DeliveryProvider provider : providers) {
      try {
        provider.deliver(request);
        return new TokenOutcome(provider.name(), false, false, null);
      } catch (DeliveryProviderException ex) {
        anyTransient |= ex.isTransient();
        invalidToken |= ex.reason() == DeliveryProviderException.Reason.INVALID_RECIPIENT;
        lastError = provider.name() + ": " + ex.reason() + " " + ex.getMessage();
        logger.warn(
            "push provider failed provider={} reason={} notificationId={}",
            provider.name(),
            ex.reason(),
            message.notificationId());
      } catch (RuntimeException ex) {
        anyTransient = true;
        lastError = provider.name() + ": " + ex.getMessage();
        logger.warn(
            "push provider threw unexpected error provider={} notificationId={}",
            provider.name(),
            message.notificationId(),
            ex);
      }
    }
    return new TokenOutcome(null, anyTransient, invalidToken, lastError);
  }

  private void deactivate(String deviceToken) {
    try {
      subscriptionRepository.deactivate(deviceToken, Instant.now(clock));
      logger.info("push subscription deactivated for invalid token");
    } catch (RuntimeException ex) {
      logger.warn("failed to deactivate push subscription", ex);
    }
  }

  private record TokenOutcome(
      String providerUsed, boolean transientFailure, boolean invalidToken, String error) {}
}
