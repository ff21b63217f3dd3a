/*
 * どこで: Notification チャネル
 * 何を: 平文をそのまま扱う FieldCipher
 * なぜ: 暗号化サービスが差し込まれていないローカル/テスト環境でも宛先解決を動かすため
 */
package com.matrimony.notification.channel;

public class PassthroughFieldCipher implements FieldCipher {

  @Override
  public String encrypt(String plaintext) {
    return plaintext;
  }

  @Override
  public String decrypt(String ciphertext) {
    return ciphertext;
  }
}
