/*
 * どこで: Notification ドメインモデル
 * 何を: 受信者の暗号化済み連絡先
 * なぜ: 平文の個人情報を配信直前まで持ち回らないため
 */
package com.matrimony.notification.model;

public record RecipientContact(String recipientId, String emailCiphertext, String phoneCiphertext) {}
