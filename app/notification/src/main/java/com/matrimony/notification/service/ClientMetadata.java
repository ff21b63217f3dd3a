/*
 * どこで: Tracking サービス層
 * 何を: トラッキング要求元の IP/User-Agent/Referer
 * なぜ: HTTP 層の型をサービスへ持ち込まずに要求元情報を渡すため
 */
package com.matrimony.notification.service;

import jakarta.servlet.http.HttpServletRequest;

public record ClientMetadata(String ipAddress, String userAgent, String referer) {

  public ClientMetadata {
    userAgent = userAgent == null || userAgent.isBlank() ? "Unknown" : userAgent;
  }

  public static ClientMetadata from(HttpServletRequest request) {
    return new ClientMetadata(
        resolveClientIp(request), request.getHeader("User-Agent"), request.getHeader("Referer"));
  }

  /**
   * 接続元アドレスを返す。信頼できるプロキシ越しの X-Forwarded-For は
   * server.forward-headers-strategy=native (Tomcat RemoteIpValve) が remoteAddr へ反映する。
   */
  public static String resolveClientIp(HttpServletRequest request) {
    return request.getRemoteAddr();
  }
}
