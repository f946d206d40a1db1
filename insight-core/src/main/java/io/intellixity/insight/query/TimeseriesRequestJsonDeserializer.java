package io.intellixity.insight.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * JSON deserializer for {@link TimeseriesRequest} in the wire shape used by the analytics RPC:
 *
 * <pre>
 * {
 *   "projectId": "p1",
 *   "startDate": 1700000000000, "endDate": "2023-11-15T00:00:00Z", "previousPeriodStartDate": ...,
 *   "series": [ { "metric": "performance.total_cost", "aggregation": "sum",
 *                 "key": null, "subkey": null, "pipeline": { "field": "user_id", "aggregation": "avg" } } ],
 *   "filters": { "topics.topics": ["a"], "evaluations.passed": { "eval-1": ["true"] } },
 *   "groupBy": "metadata.labels", "groupByKey": null,
 *   "timeScale": 60 | "full",
 *   "timeZone": "Europe/Amsterdam"
 * }
 * </pre>
 *
 * {@code tenantId} is accepted in place of {@code projectId}. Series indexes follow array order.
 */
public final class TimeseriesRequestJsonDeserializer extends JsonDeserializer<TimeseriesRequest> {
  @Override
  public TimeseriesRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("Timeseries request JSON must be an object");

    String tenantId = textOrNull(root.get("projectId"));
    if (tenantId == null) tenantId = textOrNull(root.get("tenantId"));

    FilterSpec filters = FilterSpec.empty();
    JsonNode f = root.get("filters");
    if (f != null && f.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(f, Map.class);
      filters = FilterSpec.fromNested(m);
    }

    return TimeseriesRequest.builder(tenantId)
        .period(
            instantOrNull(root.get("startDate"), "startDate"),
            instantOrNull(root.get("endDate"), "endDate"),
            instantOrNull(root.get("previousPeriodStartDate"), "previousPeriodStartDate"))
        .series(parseSeries(root.get("series")))
        .filters(filters)
        .groupBy(textOrNull(root.get("groupBy")))
        .groupByKey(textOrNull(root.get("groupByKey")))
        .granularity(parseGranularity(root.get("timeScale")))
        .timeZone(textOrNull(root.get("timeZone")))
        .build();
  }

  private static List<MetricSpec> parseSeries(JsonNode arr) {
    if (arr == null || !arr.isArray()) return List.of();
    List<MetricSpec> out = new ArrayList<>();
    int index = 0;
    for (JsonNode s : arr) {
      if (!s.isObject()) throw new QueryValidationException("series[" + index + "] must be an object");
      String metric = textOrNull(s.get("metric"));
      if (metric == null) throw new QueryValidationException("series[" + index + "] requires metric");
      AggregationKind agg = AggregationKind.fromId(textOrNull(s.get("aggregation")));

      MetricSpec spec = MetricSpec.keyed(index, metric, agg, textOrNull(s.get("key")), textOrNull(s.get("subkey")));
      JsonNode pipe = s.get("pipeline");
      if (pipe != null && pipe.isObject()) {
        String field = textOrNull(pipe.get("field"));
        String pAgg = textOrNull(pipe.get("aggregation"));
        if (field != null && pAgg != null) spec = spec.withPipeline(field, AggregationKind.fromId(pAgg));
      }
      out.add(spec);
      index++;
    }
    return out;
  }

  private static Granularity parseGranularity(JsonNode n) {
    if (n == null || n.isNull()) return Granularity.full();
    if (n.isNumber()) return Granularity.minutes(n.intValue());
    String s = n.asText().trim();
    if (s.equalsIgnoreCase("full")) return Granularity.full();
    try {
      return Granularity.minutes(Integer.parseInt(s));
    } catch (NumberFormatException e) {
      throw new QueryValidationException("timeScale must be a number of minutes or \"full\", got '" + s + "'", e);
    }
  }

  private static Instant instantOrNull(JsonNode n, String name) {
    if (n == null || n.isNull()) return null;
    if (n.isNumber()) return Instant.ofEpochMilli(n.longValue());
    String s = n.asText().trim();
    try {
      if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) return Instant.ofEpochMilli(Long.parseLong(s));
      return Instant.parse(s);
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new QueryValidationException(name + " must be epoch millis or an ISO-8601 instant, got '" + s + "'", e);
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
