/*
 * どこで: Notification チャネル
 * 何を: 個人情報フィールドの暗号化/復号の外部コラボレータ
 * なぜ: 保存時暗号化の方式をこのサービスの外に置くため
 */
package com.matrimony.notification.channel;

public interface FieldCipher {

  String encrypt(String plaintext);

  String decrypt(String ciphertext);
}
