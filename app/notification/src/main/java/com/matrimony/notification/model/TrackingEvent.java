/*
 * どこで: Notification ドメインモデル
 * 何を: 開封/クリックのエンゲージメントイベント
 * なぜ: tracking_events を追記専用で記録し、集計時に読み出すため
 */
package com.matrimony.notification.model;

import java.time.Instant;
import java.util.UUID;

public record TrackingEvent(
    UUID eventId,
    UUID trackingId,
    TrackingEventType eventType,
    String linkType,
    String destinationUrl,
    String ipMasked,
    String userAgent,
    String referer,
    Instant occurredAt) {}
