/*
 * どこで: Notification チャネル
 * 何を: recipient の email/電話番号を復号して返す
 * なぜ: 宛先の保管形式 (暗号文) をアダプタから隠すため
 */
package com.matrimony.notification.channel;

import com.matrimony.notification.model.NotificationChannel;
import com.matrimony.notification.model.RecipientContact;
import com.matrimony.notification.repository.RecipientContactRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecipientContactResolver {

  private final RecipientContactRepository contactRepository;
  private final FieldCipher fieldCipher;

  public Optional<String> resolveAddress(String recipientId, NotificationChannel channel) {
    final Optional<RecipientContact> contact = contactRepository.findByRecipientId(recipientId);
    if (contact.isEmpty()) {
      return Optional.empty();
    }
    final String ciphertext =
        switch (channel) {
          case EMAIL -> contact.get().emailCiphertext();
          case SMS -> contact.get().phoneCiphertext();
          case PUSH -> null;
        };
    if (ciphertext == null || ciphertext.isBlank()) {
      return Optional.empty();
    }
    final String address = fieldCipher.decrypt(ciphertext);
    return address == null || address.isBlank() ? Optional.empty() : Optional.of(address);
  }
}
