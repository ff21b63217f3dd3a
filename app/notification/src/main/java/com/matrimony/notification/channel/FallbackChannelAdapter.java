/*
 * どこで: Notification チャネル
 * 何を: email/sms を設定順の provider に順番に試す
 * なぜ: 1 つの配信サービスの障害で通知が止まらないようにするため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.NotificationChannel;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FallbackChannelAdapter implements ChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(FallbackChannelAdapter.class);

  private final NotificationChannel channel;
  private final List<DeliveryProvider> providers;
  private final RecipientContactResolver contactResolver;

  public FallbackChannelAdapter(
      NotificationChannel channel,
      List<DeliveryProvider> providers,
      RecipientContactResolver contactResolver) {
    if (channel == NotificationChannel.PUSH) {
      throw new IllegalArgumentException("push uses PushChannelAdapter");
    }
    this.channel = channel;
    this.providers = List.copyOf(providers);
    this.contactResolver = contactResolver;
  }

  @Override
  public NotificationChannel channel() {
    return channel;
  }

  @Override
  public ChannelSendResult send(ChannelMessage message) {
    if (providers.isEmpty()) {
      return ChannelSendResult.failed(
          FailureKind.PERMANENT, "no " + channel.value() + " provider configured");
    }
    final Optional<String> address;
    try {
      address = contactResolver.resolveAddress(message.recipientId(), channel);
    } catch (RuntimeException ex) {
      logger.warn(
          "recipient contact lookup failed channel={} recipientId={}",
          channel.value(),
          message.recipientId(),
          ex);
      return ChannelSendResult.failed(FailureKind.TRANSIENT, "contact lookup failed");
    }
    if (address.isEmpty()) {
      return ChannelSendResult.failed(
          FailureKind.PERMANENT, "no " + channel.value() + " address for recipient");
    }
    final DeliveryRequest request =
        new DeliveryRequest(
            message.notificationId(),
            message.recipientId(),
            channel,
            address.get(),
            message.subject(),
            message.body());
    boolean anyTransient = false;
    String lastError = null;
    for (DeliveryProvider provider : providers) {
      try {
        provider.deliver(request);
        return ChannelSendResult.delivered(provider.name());
      } catch (DeliveryProviderException ex) {
        anyTransient |= ex.isTransient();
        lastError = provider.name() + ": " + ex.reason() + " " + ex.getMessage();
        logger.warn(
            "provider failed, trying next channel={} provider={} reason={} notificationId={}",
            channel.value(),
            provider.name(),
            ex.reason(),
            message.notificationId());
      } catch (RuntimeException ex) {
        // 想定外の例外は provider 側の一時障害として扱う
        anyTransient = true;
        lastError = provider.name() + ": " + ex.getMessage();
        logger.warn(
            "provider threw unexpected error channel={} provider={} notificationId={}",
            channel.value(),
            provider.name(),
            message.notificationId(),
            ex);
      }
    }
    return ChannelSendResult.failed(
        anyTransient ? FailureKind.TRANSIENT : FailureKind.PERMANENT, lastError);
  }
}
