/*
 * どこで: 共通ユーティリティ
 * 何を: 実行中インスタンスのホスト名を解決する
 * なぜ: claim token と実行履歴に「どのインスタンスが処理したか」を残すため
 */
package com.matrimony.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HostNames {

  private static final Logger logger = LoggerFactory.getLogger(HostNames.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  static final String DEFAULT_HOSTNAME = "unknown-host";

  private HostNames() {}

  // コンテナでは HOSTNAME が Pod 名になるため優先する
  public static String resolve() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
