/*
 * どこで: Notification チャネル
 * 何を: チャネルからアダプタを引く表
 * なぜ: 配信パスがアダプタの組み立て方を知らずに済むようにするため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.NotificationChannel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ChannelAdapterRegistry {

  private final Map<NotificationChannel, ChannelAdapter> adapters =
      new EnumMap<>(NotificationChannel.class);

  public ChannelAdapterRegistry(List<ChannelAdapter> adapters) {
    for (ChannelAdapter adapter : adapters) {
      if (this.adapters.putIfAbsent(adapter.channel(), adapter) != null) {
        throw new IllegalStateException("duplicate channel adapter: " + adapter.channel());
      }
    }
  }

  public Optional<ChannelAdapter> adapterFor(NotificationChannel channel) {
    return Optional.ofNullable(adapters.get(channel));
  }
}
