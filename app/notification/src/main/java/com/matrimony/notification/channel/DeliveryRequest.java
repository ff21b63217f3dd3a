/*
 * どこで: Notification チャネル
 * 何を: provider へ渡す 1 宛先分の送信要求
 * なぜ: 宛先解決 (連絡先の復号/デバイストークン) を provider から切り離すため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.NotificationChannel;
import java.util.UUID;

public record DeliveryRequest(
    UUID notificationId,
    String recipientId,
    NotificationChannel channel,
    String address,
    String subject,
    String body) {}
