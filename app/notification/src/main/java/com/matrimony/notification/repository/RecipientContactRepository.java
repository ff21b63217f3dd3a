/*
 * どこで: Notification データアクセス
 * 何を: recipient_contacts から暗号化済みの連絡先を引く
 * なぜ: email/sms の宛先解決をプロフィール本体に依存させないため
 */
package com.matrimony.notification.repository;

import static com.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.matrimony.notification.model.RecipientContact;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientContactRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<RecipientContact> findByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT recipient_id, email_ciphertext, phone_ciphertext
        FROM recipient_contacts
        WHERE recipient_id = :recipientId
        """;
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource("recipientId", recipientId),
            (rs, rowNum) ->
                new RecipientContact(
                    rs.getString("recipient_id"),
                    rs.getString("email_ciphertext"),
                    rs.getString("phone_ciphertext")))
        .stream()
        .findFirst();
  }

  public void upsert(RecipientContact contact, Instant now) {
    final String sql =
        """
        INSERT INTO recipient_contacts (recipient_id, email_ciphertext, phone_ciphertext, updated_at)
        VALUES (:recipientId, :emailCiphertext, :phoneCiphertext, :now)
        ON CONFLICT (recipient_id) DO UPDATE
        SET email_ciphertext = EXCLUDED.email_ciphertext,
            phone_ciphertext = EXCLUDED.phone_ciphertext,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", contact.recipientId())
            .addValue("emailCiphertext", contact.emailCiphertext())
            .addValue("phoneCiphertext", contact.phoneCiphertext())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }
}
