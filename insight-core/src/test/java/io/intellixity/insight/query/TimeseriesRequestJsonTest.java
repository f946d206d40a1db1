package io.intellixity.insight.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TimeseriesRequestJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesFullRequest() throws Exception {
    String s = """
        {
          "projectId": "project-1",
          "startDate": 1700000000000,
          "endDate": "2023-11-16T00:00:00Z",
          "previousPeriodStartDate": "1699000000000",
          "series": [
            { "metric": "performance.total_cost", "aggregation": "sum" },
            { "metric": "evaluations.evaluation_score", "aggregation": "avg", "key": "eval-1" },
            { "metric": "metadata.trace_id", "aggregation": "cardinality",
              "pipeline": { "field": "user_id", "aggregation": "avg" } }
          ],
          "filters": {
            "topics.topics": ["a", "b"],
            "evaluations.passed": { "eval-1": ["true"] },
            "events.metrics.value": { "thumbs": { "vote": ["0", "1"] } }
          },
          "groupBy": "metadata.labels",
          "timeScale": 60,
          "timeZone": "Europe/Amsterdam"
        }
        """;
    TimeseriesRequest r = JSON.readValue(s, TimeseriesRequest.class);

    assertEquals("project-1", r.tenantId());
    assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), r.currentStart());
    assertEquals(Instant.parse("2023-11-16T00:00:00Z"), r.currentEnd());
    assertEquals(Instant.ofEpochMilli(1_699_000_000_000L), r.previousStart());
    assertEquals(r.currentStart(), r.previousEnd());

    assertEquals(3, r.series().size());
    assertEquals(AggregationKind.SUM, r.series().get(0).aggregation());
    assertEquals("eval-1", r.series().get(1).key());
    assertEquals(2, r.series().get(2).index());
    assertEquals(new PipelineSpec("user_id", AggregationKind.AVG), r.series().get(2).pipeline());

    List<FilterEntry> entries = r.filters().entries();
    assertEquals(3, entries.size());
    assertEquals(new FilterEntry("topics.topics", List.of("a", "b"), null, null), entries.get(0));
    assertEquals(new FilterEntry("evaluations.passed", List.of("true"), "eval-1", null), entries.get(1));
    assertEquals(new FilterEntry("events.metrics.value", List.of("0", "1"), "thumbs", "vote"), entries.get(2));

    assertEquals("metadata.labels", r.groupBy());
    assertEquals(Granularity.minutes(60), r.granularity());
    assertEquals("Europe/Amsterdam", r.timeZone());
  }

  @Test
  void timeScaleFullAndTenantIdAlias() throws Exception {
    String s = """
        {
          "tenantId": "t1",
          "startDate": "2024-01-02T00:00:00Z",
          "endDate": "2024-01-03T00:00:00Z",
          "previousPeriodStartDate": "2024-01-01T00:00:00Z",
          "series": [],
          "timeScale": "full"
        }
        """;
    TimeseriesRequest r = JSON.readValue(s, TimeseriesRequest.class);
    assertEquals("t1", r.tenantId());
    assertTrue(r.granularity().isFull());
    assertTrue(r.filters().isEmpty());
    assertNull(r.groupBy());
    assertNull(r.timeZone());
  }

  @Test
  void rejectsUnknownAggregation() {
    String s = """
        {
          "projectId": "p",
          "startDate": 2000, "endDate": 3000, "previousPeriodStartDate": 1000,
          "series": [ { "metric": "performance.total_cost", "aggregation": "mode" } ]
        }
        """;
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue(s, TimeseriesRequest.class));
    assertTrue(causeChainMentions(ex, "Unknown aggregation 'mode'"));
  }

  @Test
  void rejectsMissingTenant() {
    String s = """
        { "startDate": 2000, "endDate": 3000, "previousPeriodStartDate": 1000 }
        """;
    Exception ex = assertThrows(Exception.class, () -> JSON.readValue(s, TimeseriesRequest.class));
    assertTrue(causeChainMentions(ex, "tenantId is required"));
  }

  private static boolean causeChainMentions(Throwable t, String text) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c.getMessage() != null && c.getMessage().contains(text)) return true;
    }
    return false;
  }
}
