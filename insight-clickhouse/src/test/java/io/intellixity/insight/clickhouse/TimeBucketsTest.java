package io.intellixity.insight.clickhouse;

import io.intellixity.insight.query.Granularity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class TimeBucketsTest {
  private static final String C = "ts.CreatedAt";

  @Test
  void truncationTiers() {
    assertEquals("toStartOfMinute(ts.CreatedAt, 'UTC')", TimeBuckets.truncate(C, 1, "UTC"));
    assertEquals("toStartOfInterval(ts.CreatedAt, INTERVAL 5 MINUTE, 'UTC')", TimeBuckets.truncate(C, 5, "UTC"));
    assertEquals("toStartOfInterval(ts.CreatedAt, INTERVAL 90 MINUTE, 'UTC')", TimeBuckets.truncate(C, 90, "UTC"));
    assertEquals("toStartOfInterval(ts.CreatedAt, INTERVAL 3 HOUR, 'UTC')", TimeBuckets.truncate(C, 180, "UTC"));
    assertEquals("toStartOfDay(ts.CreatedAt, 'Europe/Paris')", TimeBuckets.truncate(C, 1440, "Europe/Paris"));
    assertEquals("toStartOfInterval(ts.CreatedAt, INTERVAL 7 DAY, 'UTC')", TimeBuckets.truncate(C, 7 * 1440, "UTC"));
    assertEquals("toStartOfWeek(ts.CreatedAt, 1, 'UTC')", TimeBuckets.truncate(C, 14 * 1440, "UTC"));
    assertEquals("toStartOfMonth(ts.CreatedAt, 'UTC')", TimeBuckets.truncate(C, 60 * 1440, "UTC"));
    assertThrows(IllegalArgumentException.class, () -> TimeBuckets.truncate(C, 0, "UTC"));
  }

  @Test
  void tooManyBucketsWidenToOneDay() {
    Instant start = Instant.parse("2024-01-01T00:00:00Z");
    Instant end = start.plus(Duration.ofDays(30));
    assertEquals(Granularity.minutes(60), TimeBuckets.adjust(Granularity.minutes(60), start, end, 1000));
    assertEquals(Granularity.minutes(TimeBuckets.MINUTES_PER_DAY), TimeBuckets.adjust(Granularity.minutes(1), start, end, 1000));
    assertTrue(TimeBuckets.adjust(Granularity.full(), start, end, 1).isFull());
  }

  @Test
  void invalidZonesFallBack() {
    assertEquals("America/New_York", TimeBuckets.resolveZone("America/New_York", "UTC"));
    assertEquals("UTC", TimeBuckets.resolveZone("Mars/Olympus'); DROP TABLE x --", "UTC"));
    assertEquals("UTC", TimeBuckets.resolveZone(null, "UTC"));
  }
}
