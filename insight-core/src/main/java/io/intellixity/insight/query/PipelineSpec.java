package io.intellixity.insight.query;

import java.util.Objects;

/**
 * Second-level aggregation: the inner metric is grouped by {@code field} (per user, per thread, ...)
 * and {@code aggregation} is applied across the per-bucket values.
 */
public record PipelineSpec(String field, AggregationKind aggregation) {
  public PipelineSpec {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(aggregation, "aggregation");
  }
}
