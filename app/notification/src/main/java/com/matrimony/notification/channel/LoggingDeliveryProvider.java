/*
 * どこで: Notification チャネル
 * 何を: 送信内容をログへ出して成功扱いにする provider
 * なぜ: ローカル/開発環境で外部サービスなしに配信経路を通すため
 */
package com.matrimony.notification.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeliveryProvider implements DeliveryProvider {

  private static final Logger logger = LoggerFactory.getLogger(LoggingDeliveryProvider.class);

  private final String name;

  public LoggingDeliveryProvider(String name) {
    this.name = name;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void deliver(DeliveryRequest request) {
    logger.info(
        "notification delivered (log) provider={} channel={} notificationId={} recipientId={} subject={}",
        name,
        request.channel().value(),
        request.notificationId(),
        request.recipientId(),
        request.subject());
  }
}
