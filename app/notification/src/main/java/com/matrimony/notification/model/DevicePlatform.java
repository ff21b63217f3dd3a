package com.matrimony.notification.model;

import java.util.Locale;

public enum DevicePlatform {
  WEB,
  ANDROID,
  IOS;

  public static DevicePlatform fromValue(String value) {
    if (value == null || value.isBlank()) {
      return WEB;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown platform: " + value, ex);
    }
  }
}
