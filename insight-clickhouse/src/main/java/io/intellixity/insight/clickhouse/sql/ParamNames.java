package io.intellixity.insight.clickhouse.sql;

import io.intellixity.insight.compile.ParamPlaceholders;

/**
 * Per-call parameter name generator ({@code prefix_0}, {@code prefix_1}, ...).
 * Create one per build operation; instances are not shared across threads.
 */
public final class ParamNames {
  private int n;

  public String next(String prefix) {
    return prefix + "_" + (n++);
  }

  /** Next name rendered directly as a typed placeholder. */
  public Placeholder placeholder(String prefix, String type) {
    String name = next(prefix);
    return new Placeholder(name, ParamPlaceholders.of(name, type));
  }

  public record Placeholder(String name, String sql) {}
}
