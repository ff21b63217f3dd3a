/*
 * どこで: common のイベント payload 定義
 * 何を: 各サービスが通知キューへ投入する要求を共通レコードとして提供する
 * なぜ: profile/messaging/matching から同一のペイロード形状で通知を依頼するため
 */
package com.matrimony.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequestedEvent(
    String eventId,
    String occurredAt,
    String recipientId,
    String trigger,
    List<String> channels,
    String priority,
    Map<String, Object> templateData,
    String scheduledFor,
    String traceId) {}
