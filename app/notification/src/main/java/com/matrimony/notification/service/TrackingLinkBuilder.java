/*
 * どこで: Tracking サービス層
 * 何を: email に埋め込む開封ピクセル/クリック計測 URL を組み立てる
 * なぜ: テンプレートから {tracking.*} として参照できるようにするため
 */
package com.matrimony.notification.service;

import com.matrimony.notification.config.NotificationTrackingProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class TrackingLinkBuilder {

  private final NotificationTrackingProperties properties;

  public String pixelUrl(UUID trackingId) {
    return UriComponentsBuilder.fromUriString(properties.baseUrl())
        .path("/tracking/pixel/{id}")
        .buildAndExpand(trackingId)
        .toUriString();
  }

  /** テンプレート側で {@code &type=...&url=...} を続けて書けるよう、クエリ付きで返す。 */
  public String clickBaseUrl(UUID trackingId) {
    return UriComponentsBuilder.fromUriString(properties.baseUrl())
        .path("/tracking/click/{id}")
        .queryParam("src", "email")
        .buildAndExpand(trackingId)
        .toUriString();
  }

  public String clickUrl(UUID trackingId, String linkType, String destination) {
    return UriComponentsBuilder.fromUriString(properties.baseUrl())
        .path("/tracking/click/{id}")
        .queryParam("type", "{type}")
        .queryParam("url", "{url}")
        .encode()
        .buildAndExpand(trackingId, linkType, destination)
        .toUriString();
  }

  public String pixelTag(UUID trackingId) {
    return "<img src=\""
        + pixelUrl(trackingId)
        + "\" width=\"1\" height=\"1\" alt=\"\" style=\"display:none\" />";
  }

  /** テンプレートデータへ差し込む tracking.* の値。 */
  public Map<String, Object> templateData(UUID trackingId) {
    final Map<String, Object> tracking = new LinkedHashMap<>();
    tracking.put("pixel_url", pixelUrl(trackingId));
    tracking.put("click_base_url", clickBaseUrl(trackingId));
    tracking.put("tracking_id", trackingId.toString());
    return tracking;
  }

  public boolean appendPixel() {
    return properties.appendPixel();
  }
}
