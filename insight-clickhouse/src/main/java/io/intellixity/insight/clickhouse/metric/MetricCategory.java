package io.intellixity.insight.clickhouse.metric;

/** Metric families, routed by field prefix. */
public enum MetricCategory {
  METADATA("metadata."),
  PERFORMANCE("performance."),
  EVALUATIONS("evaluations."),
  EVENTS("events."),
  SENTIMENT("sentiment."),
  THREADS("threads."),
  OTHER("");

  private final String prefix;

  MetricCategory(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() { return prefix; }

  public static MetricCategory of(String field) {
    if (field != null) {
      for (MetricCategory c : values()) {
        if (c != OTHER && field.startsWith(c.prefix)) return c;
      }
    }
    return OTHER;
  }
}
