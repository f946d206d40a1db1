package io.intellixity.insight.query;

import java.util.Objects;

/** One requested series. {@code key}/{@code subkey} scope the metric (evaluator id, event type, metric key). */
public record MetricSpec(
    int index,
    String field,
    AggregationKind aggregation,
    String key,
    String subkey,
    PipelineSpec pipeline
) {
  public MetricSpec {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(aggregation, "aggregation");
    if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    key = blankToNull(key);
    subkey = blankToNull(subkey);
  }

  public static MetricSpec of(int index, String field, AggregationKind aggregation) {
    return new MetricSpec(index, field, aggregation, null, null, null);
  }

  public static MetricSpec keyed(int index, String field, AggregationKind aggregation, String key, String subkey) {
    return new MetricSpec(index, field, aggregation, key, subkey, null);
  }

  public MetricSpec withPipeline(String bucketField, AggregationKind bucketAggregation) {
    return new MetricSpec(index, field, aggregation, key, subkey, new PipelineSpec(bucketField, bucketAggregation));
  }

  public boolean hasPipeline() { return pipeline != null; }

  private static String blankToNull(String s) {
    return (s == null || s.isEmpty()) ? null : s;
  }
}
