package io.intellixity.insight.clickhouse;

import io.intellixity.insight.query.Granularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Set;

/** Date truncation for bucketed series, plus time zone validation. */
public final class TimeBuckets {
  private static final Logger log = LoggerFactory.getLogger(TimeBuckets.class);

  static final int MINUTES_PER_DAY = 24 * 60;
  private static final Set<String> ZONES = ZoneId.getAvailableZoneIds();

  private TimeBuckets() {}

  /**
   * Truncation expression for {@code column}:
   * <ul>
   *   <li>&le; 1 minute: minute</li>
   *   <li>&lt; 1 day: N hours when minutes is a multiple of 60, else N minutes</li>
   *   <li>&le; 7 days: N days ({@code toStartOfDay} for one day)</li>
   *   <li>&le; 31 days: week, starting Monday</li>
   *   <li>otherwise month</li>
   * </ul>
   * {@code zone} must already be validated with {@link #resolveZone}.
   */
  public static String truncate(String column, int minutes, String zone) {
    if (minutes <= 0) throw new IllegalArgumentException("minutes must be > 0, got " + minutes);
    String tz = "'" + zone + "'";
    if (minutes <= 1) return "toStartOfMinute(" + column + ", " + tz + ")";
    if (minutes < MINUTES_PER_DAY) {
      if (minutes % 60 == 0) return interval(column, minutes / 60, "HOUR", tz);
      return interval(column, minutes, "MINUTE", tz);
    }
    if (minutes <= 7 * MINUTES_PER_DAY) {
      int days = minutes / MINUTES_PER_DAY;
      if (days == 1) return "toStartOfDay(" + column + ", " + tz + ")";
      return interval(column, days, "DAY", tz);
    }
    if (minutes <= 31 * MINUTES_PER_DAY) return "toStartOfWeek(" + column + ", 1, " + tz + ")";
    return "toStartOfMonth(" + column + ", " + tz + ")";
  }

  /** Widens to one day when the window would produce more than {@code maxBuckets} buckets. */
  public static Granularity adjust(Granularity g, Instant start, Instant end, int maxBuckets) {
    if (g == null || g.isFull()) return g;
    long totalMinutes = Duration.between(start, end).toMinutes();
    double buckets = (double) totalMinutes / g.minutes();
    if (buckets <= maxBuckets) return g;
    log.debug("Granularity {} yields ~{} buckets (> {}), widening to one day", g, (long) buckets, maxBuckets);
    return Granularity.minutes(MINUTES_PER_DAY);
  }

  /**
   * The zone if the JDK zone database knows it, else {@code fallback}. The result is rendered as a SQL
   * string literal, so only zone ids from the database ever reach the query.
   */
  public static String resolveZone(String zone, String fallback) {
    if (zone == null) return fallback;
    if (ZONES.contains(zone)) return zone;
    log.warn("Invalid time zone '{}', using {}", zone, fallback);
    return fallback;
  }

  private static String interval(String column, int n, String unit, String tz) {
    return "toStartOfInterval(" + column + ", INTERVAL " + n + " " + unit + ", " + tz + ")";
  }
}
