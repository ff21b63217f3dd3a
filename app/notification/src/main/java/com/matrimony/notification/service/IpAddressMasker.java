/*
 * どこで: Tracking サービス層
 * 何を: IP アドレスを保存前に粗くする (IPv4 は末尾オクテット 0、IPv6 は /48)
 * なぜ: 個人を特定できる精度の IP をトラッキング表に残さないため
 */
package com.matrimony.notification.service;

import com.google.common.net.InetAddresses;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

public final class IpAddressMasker {

  public static final String UNKNOWN = "unknown";

  private IpAddressMasker() {}

  public static String mask(String ipAddress) {
    if (ipAddress == null || ipAddress.isBlank()) {
      return UNKNOWN;
    }
    String candidate = ipAddress.trim();
    // [::1] 形式と zone id (%eth0) は取り除いてから解釈する
    if (candidate.startsWith("[") && candidate.endsWith("]")) {
      candidate = candidate.substring(1, candidate.length() - 1);
    }
    final int zoneIndex = candidate.indexOf('%');
    if (zoneIndex >= 0) {
      candidate = candidate.substring(0, zoneIndex);
    }
    if (!InetAddresses.isInetAddress(candidate)) {
      return UNKNOWN;
    }
    final InetAddress address = InetAddresses.forString(candidate);
    final byte[] bytes = address.getAddress();
    if (address instanceof Inet4Address) {
      bytes[3] = 0;
    } else {
      for (int i = 6; i < bytes.length; i++) {
        bytes[i] = 0;
      }
    }
    try {
      return InetAddresses.toAddrString(InetAddress.getByAddress(bytes));
    } catch (UnknownHostException ex) {
      // getAddress() 由来の 4/16 バイトなので到達しない
      throw new IllegalStateException("unexpected address length " + bytes.length, ex);
    }
  }
}
