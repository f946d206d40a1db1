package io.intellixity.insight.query;

import java.util.Locale;
import java.util.Map;

/** Aggregation requested for a metric series. Percentile kinds carry their fixed fraction. */
public enum AggregationKind {
  AVG("avg"),
  SUM("sum"),
  MIN("min"),
  MAX("max"),
  CARDINALITY("cardinality"),
  TERMS("terms"),
  MEDIAN("median"),
  P90("p90"),
  P95("p95"),
  P99("p99");

  private static final Map<AggregationKind, Double> PERCENTILES = Map.of(
      MEDIAN, 0.5,
      P90, 0.9,
      P95, 0.95,
      P99, 0.99
  );

  private final String id;

  AggregationKind(String id) {
    this.id = id;
  }

  public String id() { return id; }

  public boolean isPercentile() { return PERCENTILES.containsKey(this); }

  /** Fraction for percentile kinds; throws for the others. */
  public double percentile() {
    Double p = PERCENTILES.get(this);
    if (p == null) throw new IllegalStateException(id + " is not a percentile aggregation");
    return p;
  }

  /** cardinality and terms both count distinct values. */
  public boolean isDistinctCount() { return this == CARDINALITY || this == TERMS; }

  public static AggregationKind fromId(String id) {
    if (id == null || id.isBlank()) throw new QueryValidationException("Aggregation is required");
    String s = id.trim().toLowerCase(Locale.ROOT);
    for (AggregationKind k : values()) {
      if (k.id.equals(s)) return k;
    }
    throw new QueryValidationException("Unknown aggregation '" + id + "'");
  }
}
