/*
 * どこで: Notification チャネル
 * 何を: CI/Test 専用で特定 recipient への送信を一時失敗させる provider
 * なぜ: 実コード経路を汚さずに E2E で retry -> DLQ を再現するため
 */
package com.matrimony.notification.channel;

public class FailureInjectingDeliveryProvider implements DeliveryProvider {

  private final DeliveryProvider delegate;
  private final String recipientIdPrefix;

  public FailureInjectingDeliveryProvider(DeliveryProvider delegate, String recipientIdPrefix) {
    this.delegate = delegate;
    this.recipientIdPrefix = recipientIdPrefix;
  }

  @Override
  public String name() {
    return delegate.name();
  }

  @Override
  public void deliver(DeliveryRequest request) {
    if (shouldInjectFailure(request.recipientId())) {
      throw new DeliveryProviderException(
          DeliveryProviderException.Reason.UNAVAILABLE,
          "delivery failure injection matched recipientId=" + request.recipientId());
    }
    delegate.deliver(request);
  }

  private boolean shouldInjectFailure(String recipientId) {
    if (recipientIdPrefix == null || recipientIdPrefix.isBlank() || recipientId == null) {
      return false;
    }
    return recipientId.startsWith(recipientIdPrefix);
  }
}
