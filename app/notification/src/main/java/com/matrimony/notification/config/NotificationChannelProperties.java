/*
 * どこで: Notification チャネル設定
 * 何を: チャネルごとの provider 一覧 (優先順) を保持する
 * なぜ: 送信 provider を設定だけで差し替え/追加できるようにするため
 */
package com.matrimony.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.channels")
@Validated
public record NotificationChannelProperties(
    @Valid Channel email, @Valid Channel sms, @Valid Channel push) {

  public NotificationChannelProperties {
    email = email == null ? new Channel(List.of()) : email;
    sms = sms == null ? new Channel(List.of()) : sms;
    push = push == null ? new Channel(List.of()) : push;
  }

  public record Channel(@Valid List<Provider> providers) {
    public Channel {
      providers = providers == null ? List.of() : List.copyOf(providers);
    }
  }

  public enum ProviderType {
    HTTP,
    LOG
  }

  public record Provider(
      @NotBlank String name,
      @NotNull ProviderType type,
      String baseUrl,
      String path,
      String apiKeyHeader,
      String apiKey,
      Duration timeout) {

    public Provider {
      path = path == null || path.isBlank() ? "/" : path;
      apiKeyHeader = apiKeyHeader == null || apiKeyHeader.isBlank() ? "Authorization" : apiKeyHeader;
      timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    }
  }
}
