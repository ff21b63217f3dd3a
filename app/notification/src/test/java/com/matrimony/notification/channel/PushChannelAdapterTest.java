/*
 * どこで: Notification チャネル層のユニットテスト
 * 何を: push の複数トークン送信、部分成功、無効トークンの無効化を検証する
 * なぜ: 1 台でも届けば成功とする判定と購読の掃除を担保するため
 */
package com.matrimony.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.matrimony.notification.model.ChannelSubscription;
import com.matrimony.notification.model.DevicePlatform;
import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import com.matrimony.notification.repository.ChannelSubscriptionRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PushChannelAdapterTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private ChannelSubscriptionRepository subscriptionRepository;

  private DeliveryProvider provider;
  private PushChannelAdapter adapter;

  @BeforeEach
  void setUp() {
    provider = mock(DeliveryProvider.class);
    lenient().when(provider.name()).thenReturn("push-log");
    adapter =
        new PushChannelAdapter(
            List.of(provider), subscriptionRepository, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void partialSuccessCountsAsDelivered() {
    when(subscriptionRepository.findActiveByRecipientId("user-1"))
        .thenReturn(List.of(subscription("token-a"), subscription("token-b"), subscription("token-c")));
    doNothing().when(provider).deliver(argThat(request -> !"token-b".equals(request.address())));
    doThrow(new DeliveryProviderException(DeliveryProviderException.Reason.UNAVAILABLE, "down"))
        .when(provider)
        .deliver(argThat(request -> "token-b".equals(request.address())));

    final ChannelSendResult result = adapter.send(message());

    assertThat(result.success()).isTrue();
    assertThat(result.deliveredCount()).isEqualTo(2);
    assertThat(result.failedCount()).isEqualTo(1);
    assertThat(result.providerUsed()).isEqualTo("push-log");
    verify(subscriptionRepository, never()).deactivate(any(), any());
  }

  @Test
  void invalidTokenIsDeactivated() {
    when(subscriptionRepository.findActiveByRecipientId("user-1"))
        .thenReturn(List.of(subscription("stale-token")));
    doThrow(
            new DeliveryProviderException(
                DeliveryProviderException.Reason.INVALID_RECIPIENT, "unregistered"))
        .when(provider)
        .deliver(any());

    final ChannelSendResult result = adapter.send(message());

    assertThat(result.success()).isFalse();
    assertThat(result.failureKind()).isEqualTo(FailureKind.PERMANENT);
    assertThat(result.failedCount()).isEqualTo(1);
    verify(subscriptionRepository).deactivate(eq("stale-token"), eq(FIXED_NOW));
  }

  @Test
  void allTokensFailingTransientlyIsTransient() {
    when(subscriptionRepository.findActiveByRecipientId("user-1"))
        .thenReturn(List.of(subscription("token-a"), subscription("token-b")));
    doThrow(new DeliveryProviderException(DeliveryProviderException.Reason.RATE_LIMITED, "slow down"))
        .when(provider)
        .deliver(any());

    final ChannelSendResult result = adapter.send(message());

    assertThat(result.isTransientFailure()).isTrue();
    assertThat(result.failedCount()).isEqualTo(2);
  }

  @Test
  void noSubscriptionsIsPermanentFailure() {
    when(subscriptionRepository.findActiveByRecipientId("user-1")).thenReturn(List.of());

    final ChannelSendResult result = adapter.send(message());

    assertThat(result.failureKind()).isEqualTo(FailureKind.PERMANENT);
    assertThat(result.error()).isEqualTo("no active push subscription");
    verify(provider, never()).deliver(any());
  }

  @Test
  void subscriptionLookupFailureIsTransient() {
    when(subscriptionRepository.findActiveByRecipientId("user-1"))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    final ChannelSendResult result = adapter.send(message());

    assertThat(result.isTransientFailure()).isTrue();
  }

  @Test
  void noProviderConfiguredSkipsLookup() {
    final PushChannelAdapter empty =
        new PushChannelAdapter(List.of(), subscriptionRepository, Clock.systemUTC());

    final ChannelSendResult result = empty.send(message());

    assertThat(result.failureKind()).isEqualTo(FailureKind.PERMANENT);
    verifyNoInteractions(subscriptionRepository);
  }

  private ChannelSubscription subscription(String token) {
    return new ChannelSubscription("user-1", token, DevicePlatform.ANDROID, true, FIXED_NOW, FIXED_NOW);
  }

  private ChannelMessage message() {
    return new ChannelMessage(
        UUID.randomUUID(),
        "user-1",
        NotificationChannel.PUSH,
        "new_match",
        NotificationPriority.HIGH,
        "New match",
        "Ravi likes you");
  }
}
