package io.intellixity.insight.clickhouse;

import io.intellixity.insight.query.MetricSpec;
import io.intellixity.insight.query.TimeseriesRequest;
import io.intellixity.insight.spi.AnalyticsDialect;
import io.intellixity.insight.spi.DiscoveredDialectRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.intellixity.insight.query.AggregationKind.SUM;
import static org.junit.jupiter.api.Assertions.*;

final class ClickHouseAnalyticsDialectTest {
  @Test
  void discoveredThroughFactoriesFile() {
    DiscoveredDialectRegistry registry = new DiscoveredDialectRegistry();
    AnalyticsDialect d = registry.get(ClickHouseAnalyticsDialect.ID);
    assertInstanceOf(ClickHouseAnalyticsDialect.class, d);
  }

  @Test
  void delegatesToBuilderWithClasspathSettings() {
    ClickHouseAnalyticsDialect d = new ClickHouseAnalyticsDialect();
    assertEquals(1000, d.builder().settings().maxBuckets());

    Instant prev = Instant.parse("2024-01-01T00:00:00Z");
    Instant start = Instant.parse("2024-01-02T00:00:00Z");
    TimeseriesRequest r = TimeseriesRequest.builder("p1")
        .period(start, Instant.parse("2024-01-03T00:00:00Z"), prev)
        .series(MetricSpec.of(0, "performance.total_cost", SUM))
        .build();
    assertEquals(d.builder().buildTimeseries(r), d.buildTimeseries(r));
  }
}
