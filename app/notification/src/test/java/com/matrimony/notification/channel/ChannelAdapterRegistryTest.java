package com.matrimony.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.repository.ChannelSubscriptionRepository;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ChannelAdapterRegistryTest {

  private final RecipientContactResolver resolver = Mockito.mock(RecipientContactResolver.class);

  @Test
  void looksUpAdapterByChannel() {
    final FallbackChannelAdapter email =
        new FallbackChannelAdapter(NotificationChannel.EMAIL, List.of(), resolver);
    final PushChannelAdapter push =
        new PushChannelAdapter(
            List.of(), Mockito.mock(ChannelSubscriptionRepository.class), Clock.systemUTC());

    final ChannelAdapterRegistry registry = new ChannelAdapterRegistry(List.of(email, push));

    assertThat(registry.adapterFor(NotificationChannel.EMAIL)).containsSame(email);
    assertThat(registry.adapterFor(NotificationChannel.PUSH)).containsSame(push);
    assertThat(registry.adapterFor(NotificationChannel.SMS)).isEmpty();
  }

  @Test
  void rejectsDuplicateChannel() {
    final List<ChannelAdapter> adapters =
        List.of(
            new FallbackChannelAdapter(NotificationChannel.SMS, List.of(), resolver),
            new FallbackChannelAdapter(NotificationChannel.SMS, List.of(), resolver));

    assertThatThrownBy(() -> new ChannelAdapterRegistry(adapters))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate");
  }

  @Test
  void fallbackAdapterRefusesPush() {
    assertThatThrownBy(
            () -> new FallbackChannelAdapter(NotificationChannel.PUSH, List.of(), resolver))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
