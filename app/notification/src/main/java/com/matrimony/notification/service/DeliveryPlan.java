package com.matrimony.notification.service;

import com.matrimony.notification.model.NotificationChannel;
import java.time.Instant;
import java.util.List;

/** 配信設定を適用した後のチャネルと送信予定時刻。 */
public record DeliveryPlan(List<NotificationChannel> channels, Instant scheduledFor) {

  public DeliveryPlan {
    channels = List.copyOf(channels);
  }
}
