/*
 * どこで: Notification チャネル
 * 何を: HTTP API 型の配信サービスへ 1 宛先分の送信を POST する
 * なぜ: 外部サービスの HTTP ステータスを一時失敗/恒久失敗へ一貫して変換するため
 */
package com.matrimony.notification.channel;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class HttpDeliveryProvider implements DeliveryProvider {

  private static final Logger logger = LoggerFactory.getLogger(HttpDeliveryProvider.class);

  private final String name;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は provider ごとに組み立てた共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient restClient;

  private final String path;
  private final String apiKeyHeader;
  private final String apiKey;

  public HttpDeliveryProvider(
      String name, RestClient restClient, String path, String apiKeyHeader, String apiKey) {
    this.name = name;
    this.restClient = restClient;
    this.path = path;
    this.apiKeyHeader = apiKeyHeader;
    this.apiKey = apiKey;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void deliver(DeliveryRequest request) {
    final OutboundMessage body =
        new OutboundMessage(
            request.notificationId(),
            request.channel().value(),
            request.address(),
            request.subject(),
            request.body());
    try {
      RestClient.RequestBodySpec spec =
          restClient.post().uri(path).contentType(MediaType.APPLICATION_JSON);
      if (apiKey != null && !apiKey.isBlank()) {
        spec = spec.header(apiKeyHeader, apiKey);
      }
      spec.body(body).retrieve().toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
  }

  private DeliveryProviderException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "delivery provider {} failed with http status={} statusText={}",
        name,
        status,
        ex.getStatusText());
    if (status == 408) {
      return new DeliveryProviderException(
          DeliveryProviderException.Reason.TIMEOUT, "provider request timeout", ex);
    }
    if (status == 429) {
      return new DeliveryProviderException(
          DeliveryProviderException.Reason.RATE_LIMITED, "provider rate limited", ex);
    }
    if (status == 401 || status == 403) {
      return new DeliveryProviderException(
          DeliveryProviderException.Reason.AUTH, "provider rejected credentials", ex);
    }
    if (status == 400 || status == 404 || status == 410 || status == 422) {
      return new DeliveryProviderException(
          DeliveryProviderException.Reason.INVALID_RECIPIENT, "provider rejected recipient", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new DeliveryProviderException(
          DeliveryProviderException.Reason.UNAVAILABLE, "provider server error", ex);
    }
    return new DeliveryProviderException(
        DeliveryProviderException.Reason.REJECTED, "provider rejected message", ex);
  }

  private DeliveryProviderException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("delivery provider {} timed out", name);
      return new DeliveryProviderException(
          DeliveryProviderException.Reason.TIMEOUT, "provider request timeout", ex);
    }
    logger.warn("delivery provider {} connection failed", name, ex);
    return new DeliveryProviderException(
        DeliveryProviderException.Reason.UNAVAILABLE, "provider connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record OutboundMessage(
      UUID notificationId, String channel, String to, String subject, String body) {}
}
