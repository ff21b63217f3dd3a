/*
 * どこで: Notification サービス層
 * 何を: 指定 id の通知キュー行が無いことを表す
 * なぜ: 分析 API の 404 応答へ変換するため
 */
package com.matrimony.notification.service;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
