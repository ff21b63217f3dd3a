/*
 * どこで: Tracking API
 * 何を: 開封ピクセル、クリックのリダイレクト、分析結果を返す
 * なぜ: メール内のリンク/画像から開封とクリックを計測するため
 */
package com.matrimony.notification.api;

import com.matrimony.notification.service.ClientMetadata;
import com.matrimony.notification.service.TrackingAnalyticsService;
import com.matrimony.notification.service.TrackingAnalyticsService.AnalyticsSummary;
import com.matrimony.notification.service.TrackingAnalyticsService.MessageAnalytics;
import com.matrimony.notification.service.TrackingCollector;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tracking")
@RequiredArgsConstructor
public class TrackingController {

  private static final Logger logger = LoggerFactory.getLogger(TrackingController.class);

  // 1x1 透過 PNG
  static final byte[] PIXEL =
      Base64.getDecoder()
          .decode(
              "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAQAAAC1HAwCAAAAC0lEQVR42mNkYAAAAAYAAjCB0C8AAAAASUVORK5CYII=");
  private static final String DEFAULT_LINK_TYPE = "generic";

  private final TrackingCollector collector;
  private final TrackingAnalyticsService analyticsService;

  /** 記録の成否に関わらず常にピクセルを返す。 */
  @GetMapping("/pixel/{trackingId}")
  public ResponseEntity<byte[]> pixel(
      @PathVariable("trackingId") String trackingId, HttpServletRequest request) {
    parseTrackingId(trackingId)
        .ifPresent(id -> collector.recordOpen(id, ClientMetadata.from(request)));
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .cacheControl(CacheControl.noStore().mustRevalidate())
        .header(HttpHeaders.PRAGMA, "no-cache")
        .header(HttpHeaders.EXPIRES, "0")
        .body(PIXEL.clone());
  }

  @GetMapping("/click/{trackingId}")
  public ResponseEntity<Void> click(
      @PathVariable("trackingId") String trackingId,
      @RequestParam("url") String url,
      @RequestParam(name = "type", required = false) String linkType,
      HttpServletRequest request) {
    final URI destination = validateRedirect(url);
    final String type = linkType == null || linkType.isBlank() ? DEFAULT_LINK_TYPE : linkType;
    parseTrackingId(trackingId)
        .ifPresent(
            id -> collector.recordClick(id, type, destination.toString(), ClientMetadata.from(request)));
    return ResponseEntity.status(HttpStatus.FOUND).location(destination).build();
  }

  @GetMapping("/analytics/{trackingId}")
  public MessageAnalytics analytics(@PathVariable("trackingId") UUID trackingId) {
    return analyticsService.messageAnalytics(trackingId);
  }

  @GetMapping("/stats/summary")
  public AnalyticsSummary summary(@RequestParam(name = "days", defaultValue = "30") int days) {
    return analyticsService.summary(days);
  }

  // open redirect 先は http/https の絶対 URL に限る
  private static URI validateRedirect(String url) {
    final URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("invalid redirect url", ex);
    }
    final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
      throw new IllegalArgumentException("redirect url must be an absolute http(s) url");
    }
    return uri;
  }

  private static Optional<UUID> parseTrackingId(String value) {
    try {
      return Optional.of(UUID.fromString(value));
    } catch (IllegalArgumentException ex) {
      logger.debug("ignoring tracking request with invalid id={}", value);
      return Optional.empty();
    }
  }
}
