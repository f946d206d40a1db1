package io.intellixity.insight.clickhouse.metric;

import java.util.Objects;

/**
 * Inner aggregation beneath an outer one.
 * <p>
 * {@code innerSelect}/{@code innerGroupBy} read from the filtered base tables when {@code nested} is null
 * (two levels), or from the rows produced by {@code nested} (three levels). {@code outerAggregation} is applied
 * across the inner rows; on a nested level it names the aggregation the enclosing level performs.
 */
public record SubqueryDescriptor(
    String innerSelect,
    String innerGroupBy,
    String outerAggregation,
    SubqueryDescriptor nested
) {
  public SubqueryDescriptor {
    Objects.requireNonNull(innerSelect, "innerSelect");
    Objects.requireNonNull(innerGroupBy, "innerGroupBy");
    Objects.requireNonNull(outerAggregation, "outerAggregation");
    if (nested != null && nested.nested() != null) {
      throw new IllegalArgumentException("At most three aggregation levels are supported");
    }
  }

  public static SubqueryDescriptor twoLevel(String innerSelect, String innerGroupBy, String outerAggregation) {
    return new SubqueryDescriptor(innerSelect, innerGroupBy, outerAggregation, null);
  }

  /** Total aggregation levels including the outer one: 2 or 3. */
  public int levels() { return nested == null ? 2 : 3; }
}
