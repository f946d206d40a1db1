package io.intellixity.insight.clickhouse.metric;

import io.intellixity.insight.clickhouse.fields.TableId;

import java.util.*;

/**
 * One translated series: aggregate expression, its back-quoted alias, the child tables it reads
 * and its bound values. Multi-level metrics carry a {@link SubqueryDescriptor} and cannot be placed
 * into a flat GROUP BY.
 */
public record MetricTranslation(
    String expression,
    String alias,
    Set<TableId> requiredJoins,
    Map<String, Object> params,
    SubqueryDescriptor subquery
) {
  public MetricTranslation {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(alias, "alias");
    requiredJoins = requiredJoins == null || requiredJoins.isEmpty()
        ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(requiredJoins));
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public boolean requiresSubquery() { return subquery != null; }

  /** The table whose rows this metric aggregates: its child table, or the primary table when it needs none. */
  public TableId source() {
    if (requiredJoins.isEmpty()) return TableId.TRACE_SUMMARIES;
    if (requiredJoins.size() > 1) throw new IllegalStateException("Metric " + alias + " reads more than one child table");
    return requiredJoins.iterator().next();
  }

  public String quotedAlias() { return "`" + alias + "`"; }

  /** {@code expression AS `alias`} */
  public String selectItem() { return expression + " AS " + quotedAlias(); }
}
