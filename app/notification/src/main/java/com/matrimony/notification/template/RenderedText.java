/*
 * どこで: Notification テンプレート
 * 何を: 描画結果と未解決プレースホルダの一覧
 * なぜ: 欠損データで失敗させず、欠損があったことだけを呼び出し元へ伝えるため
 */
package com.matrimony.notification.template;

import java.util.List;

public record RenderedText(String text, List<String> unresolvedPlaceholders) {

  public RenderedText {
    text = text == null ? "" : text;
    unresolvedPlaceholders =
        unresolvedPlaceholders == null ? List.of() : List.copyOf(unresolvedPlaceholders);
  }

  public boolean fullyResolved() {
    return unresolvedPlaceholders.isEmpty();
  }
}
