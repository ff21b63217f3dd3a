/*
 * どこで: Notification サービス層
 * 何を: dispatch pass 内での item 1 件の結末
 * なぜ: 集計とメトリクスのタグを同じ値から作るため
 */
package com.matrimony.notification.service;

import java.util.Locale;

enum ItemOutcome {
  SENT,
  FAILED,
  SKIPPED,
  RETRIED,
  POISONED,
  LOST;

  String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
