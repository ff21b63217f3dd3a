/*
 * どこで: Notification チャネル
 * 何を: email/sms/push の送信口の共通契約
 * なぜ: provider の差し替えを配信パスから見えなくするため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.NotificationChannel;

public interface ChannelAdapter {

  NotificationChannel channel();

  /** 例外は投げない。provider の失敗はすべて {@link ChannelSendResult} に変換して返す。 */
  ChannelSendResult send(ChannelMessage message);
}
