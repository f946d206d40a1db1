package io.intellixity.insight.clickhouse.filter;

import io.intellixity.insight.clickhouse.fields.TableId;

import java.util.*;

/**
 * A WHERE fragment (without the keyword), the child tables it needs joined and its bound values.
 * {@code 1=1} marks the trivial (no-op) fragment.
 */
public record FilterTranslation(
    String whereClause,
    Set<TableId> requiredJoins,
    Map<String, Object> params,
    boolean usesExistsSubquery
) {
  public static final String TRUE = "1=1";
  public static final FilterTranslation TRIVIAL = new FilterTranslation(TRUE, Set.of(), Map.of(), false);

  public FilterTranslation {
    Objects.requireNonNull(whereClause, "whereClause");
    requiredJoins = requiredJoins == null || requiredJoins.isEmpty()
        ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(requiredJoins));
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  static FilterTranslation of(String whereClause, Map<String, Object> params) {
    return new FilterTranslation(whereClause, Set.of(), params, false);
  }

  static FilterTranslation exists(String whereClause, Map<String, Object> params) {
    return new FilterTranslation(whereClause, Set.of(), params, true);
  }

  public boolean isTrivial() { return TRUE.equals(whereClause); }
}
