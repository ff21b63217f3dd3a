/*
 * どこで: Notification ドメインモデル
 * 何を: push 配信先デバイストークンの登録情報
 * なぜ: 1 受信者から N 台の配信先を解決するため
 */
package com.matrimony.notification.model;

import java.time.Instant;

public record ChannelSubscription(
    String recipientId,
    String deviceToken,
    DevicePlatform platform,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {}
