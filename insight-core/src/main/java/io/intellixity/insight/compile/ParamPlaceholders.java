package io.intellixity.insight.compile;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans SQL for ClickHouse-style typed placeholders: {@code {name:Type}}, e.g. {@code {topicIds_0:Array(String)}}.
 *
 * Rules:
 * - Name is [A-Za-z_][A-Za-z0-9_]*, followed by ':' and a type up to the matching '}'.
 * - Placeholders inside single-quoted strings or back-quoted identifiers are ignored.
 * - '' and backslash escapes inside strings are honored.
 */
public final class ParamPlaceholders {
  private ParamPlaceholders() {}

  public record Placeholder(String name, String type) {}

  /** Placeholders in order of appearance; repeated names are reported each time. */
  public static List<Placeholder> scan(String sql) {
    if (sql == null) return List.of();
    List<Placeholder> out = new ArrayList<>();
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        if (ch == '\\' && quote == '\'') {
          i++;
          continue;
        }
        if (ch == quote) {
          // '' escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            i++;
            continue;
          }
          quote = 0;
        }
        continue;
      }

      if (ch == '\'' || ch == '`') {
        quote = ch;
        continue;
      }

      if (ch == '{') {
        int start = i + 1;
        if (start >= sql.length() || !isIdentStart(sql.charAt(start))) continue;
        int end = start + 1;
        while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
        if (end >= sql.length() || sql.charAt(end) != ':') continue;
        int close = sql.indexOf('}', end + 1);
        if (close < 0) continue;
        out.add(new Placeholder(sql.substring(start, end), sql.substring(end + 1, close).trim()));
        i = close;
      }
    }
    return out;
  }

  /** Render a placeholder for a bound parameter. */
  public static String of(String name, String type) {
    return "{" + name + ":" + type + "}";
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
