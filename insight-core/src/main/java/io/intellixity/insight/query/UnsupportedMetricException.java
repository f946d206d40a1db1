package io.intellixity.insight.query;

/** A known metric whose aggregation shape has no SQL translation. Never replaced by a silent zero. */
public final class UnsupportedMetricException extends RuntimeException {
  private final String metric;

  public UnsupportedMetricException(String metric, String reason) {
    super("Unsupported metric '" + metric + "': " + reason);
    this.metric = metric;
  }

  public String metric() { return metric; }
}
