/*
 * どこで: Notification チャネル
 * 何を: 描画済みの 1 チャネル分の送信内容
 * なぜ: アダプタへテンプレートやキュー行を渡さず、送る中身だけを渡すため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.NotificationPriority;
import java.util.UUID;

public record ChannelMessage(
    UUID notificationId,
    String recipientId,
    NotificationChannel channel,
    String trigger,
    NotificationPriority priority,
    String subject,
    String body) {}
