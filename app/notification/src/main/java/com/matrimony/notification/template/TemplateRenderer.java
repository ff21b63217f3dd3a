/*
 * どこで: Notification テンプレート
 * 何を: {a.b} プレースホルダと {% if %} ブロックを入れ子 Map のデータで展開する
 * なぜ: 通知文面をデータと分離し、DB 上のテンプレート差し替えだけで文言を変えるため
 */
package com.matrimony.notification.template;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 純粋関数のテンプレート描画。
 *
 * <ul>
 *   <li>{@code {name}} / {@code {a.b.c}}: 入れ子の Map を辿って値を埋める。解決できなければそのまま残す。
 *   <li>{@code {% if path %}...{% endif %}}: 値が truthy のときだけ中身を残す。
 *   <li>{@code {% if path OP literal %}...{% endif %}}: OP は == != &gt; &gt;= &lt; &lt;=。両辺が数値なら数値比較、
 *       それ以外は文字列の等価比較。
 * </ul>
 *
 * <p>ブロックの入れ子は扱わない。例外は投げない。
 */
@Component
public class TemplateRenderer {

  private static final Pattern CONDITIONAL =
      Pattern.compile(
          "\\{%\\s*if\\s+([A-Za-z_][\\w.]*)\\s*(?:(==|!=|>=|<=|>|<)\\s*(.+?)\\s*)?%\\}(.*?)\\{%\\s*endif\\s*%\\}",
          Pattern.DOTALL);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][\\w.]*)\\}");

  public RenderedText render(String template, Map<String, ?> data) {
    if (template == null) {
      return new RenderedText("", List.of());
    }
    final Map<String, ?> safeData = data == null ? Map.of() : data;
    final String withBlocks = applyConditionals(template, safeData);
    return substitute(withBlocks, safeData);
  }

  private String applyConditionals(String template, Map<String, ?> data) {
    final Matcher matcher = CONDITIONAL.matcher(template);
    final StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      final Object value = lookup(data, matcher.group(1));
      final boolean keep =
          matcher.group(2) == null
              ? isTruthy(value)
              : compare(value, matcher.group(2), parseLiteral(matcher.group(3)));
      matcher.appendReplacement(out, Matcher.quoteReplacement(keep ? matcher.group(4) : ""));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private RenderedText substitute(String template, Map<String, ?> data) {
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder out = new StringBuilder();
    final Set<String> unresolved = new LinkedHashSet<>();
    while (matcher.find()) {
      final String path = matcher.group(1);
      final Object value = lookup(data, path);
      final String replacement;
      if (value == null) {
        unresolved.add(path);
        replacement = matcher.group();
      } else {
        replacement = format(value);
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return new RenderedText(out.toString(), new ArrayList<>(unresolved));
  }

  static Object lookup(Map<String, ?> data, String path) {
    Object current = data;
    for (String segment : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  private static boolean isTruthy(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof Number number) {
      return toDecimal(number).signum() != 0;
    }
    if (value instanceof CharSequence text) {
      return text.length() > 0;
    }
    if (value instanceof Collection<?> collection) {
      return !collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return !map.isEmpty();
    }
    return true;
  }

  private static boolean compare(Object left, String operator, Object right) {
    final BigDecimal leftNumber = asNumber(left);
    final BigDecimal rightNumber = asNumber(right);
    if (leftNumber != null && rightNumber != null) {
      final int cmp = leftNumber.compareTo(rightNumber);
      return switch (operator) {
        case "==" -> cmp == 0;
        case "!=" -> cmp != 0;
        case ">" -> cmp > 0;
        case ">=" -> cmp >= 0;
        case "<" -> cmp < 0;
        case "<=" -> cmp <= 0;
        default -> false;
      };
    }
    // 数値でない場合は等価比較のみ意味を持つ
    final String leftText = left == null ? null : String.valueOf(left);
    final String rightText = right == null ? null : String.valueOf(right);
    return switch (operator) {
      case "==" -> leftText != null && leftText.equals(rightText);
      case "!=" -> leftText == null ? rightText != null : !leftText.equals(rightText);
      default -> false;
    };
  }

  private static Object parseLiteral(String raw) {
    final String literal = raw.trim();
    if (literal.length() >= 2
        && ((literal.startsWith("'") && literal.endsWith("'"))
            || (literal.startsWith("\"") && literal.endsWith("\"")))) {
      return literal.substring(1, literal.length() - 1);
    }
    if ("true".equals(literal) || "false".equals(literal)) {
      return Boolean.valueOf(literal);
    }
    if ("null".equals(literal)) {
      return null;
    }
    final BigDecimal number = asNumber(literal);
    return number != null ? number : literal;
  }

  private static BigDecimal asNumber(Object value) {
    if (value instanceof Number number) {
      return toDecimal(number);
    }
    if (value instanceof String text) {
      try {
        return new BigDecimal(text.trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  private static BigDecimal toDecimal(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof Double || number instanceof Float) {
      final double raw = number.doubleValue();
      return Double.isFinite(raw) ? BigDecimal.valueOf(raw) : BigDecimal.ZERO;
    }
    return new BigDecimal(number.toString());
  }

  private static String format(Object value) {
    if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
      // 85.0 のような整数値は 85 と表示する
      return toDecimal((Number) value).stripTrailingZeros().toPlainString();
    }
    return String.valueOf(value);
  }
}
