/*
 * どこで: Notification チャネル
 * 何を: 外部配信サービス 1 つ分の送信契約
 * なぜ: HTTP/ログ/失敗注入の実装を同じ fallback 連鎖に並べるため
 */
package com.matrimony.notification.channel;

public interface DeliveryProvider {

  String name();

  /** 失敗時は理由付きの {@link DeliveryProviderException} を投げる。 */
  void deliver(DeliveryRequest request);
}
