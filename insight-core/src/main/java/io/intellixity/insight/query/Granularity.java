package io.intellixity.insight.query;

/** Either one summary bucket per period ({@link #full()}) or fixed-size buckets in minutes. */
public record Granularity(Integer minutes) {
  private static final Granularity FULL = new Granularity(null);

  public Granularity {
    if (minutes != null && minutes <= 0) throw new QueryValidationException("Granularity minutes must be > 0, got " + minutes);
  }

  public static Granularity full() { return FULL; }

  public static Granularity minutes(int minutes) { return new Granularity(minutes); }

  public boolean isFull() { return minutes == null; }

  @Override
  public String toString() { return isFull() ? "full" : minutes + "m"; }
}
