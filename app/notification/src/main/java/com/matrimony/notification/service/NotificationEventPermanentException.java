/*
 * どこで: Notification サービス層
 * 何を: 再配信しても処理できない通知依頼を示す例外
 * なぜ: NATS 再配信を止めて TERM する判断に使うため
 */
package com.matrimony.notification.service;

public class NotificationEventPermanentException extends RuntimeException {

    public NotificationEventPermanentException(String message, Throwable cause) {
        super(message, cause);
    }
}
