package io.intellixity.insight.clickhouse;

import io.intellixity.insight.clickhouse.metric.MetricTranslator;
import io.intellixity.insight.query.AggregationKind;
import io.intellixity.insight.query.Granularity;
import io.intellixity.insight.query.MetricSpec;

import java.util.*;

/** Reshapes executed timeseries rows into the bucket format dashboards consume. */
public final class TimeseriesResultParser {
  static final String FULL_DATE = "full";

  private TimeseriesResultParser() {}

  public static TimeseriesResult parse(List<Map<String, Object>> rows, List<MetricSpec> series,
                                       String groupBy, Granularity granularity) {
    boolean full = granularity == null || granularity.isFull();
    Map<String, Map<String, Object>> previous = new TreeMap<>();
    Map<String, Map<String, Object>> current = new TreeMap<>();

    for (Map<String, Object> row : rows) {
      String date = full ? FULL_DATE : String.valueOf(row.get("date"));
      Map<String, Map<String, Object>> target = "current".equals(row.get("period")) ? current : previous;
      Map<String, Object> bucket = target.computeIfAbsent(date, d -> {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("date", d);
        return b;
      });

      Object groupKey = row.get("group_key");
      Map<String, Object> values = bucket;
      if (groupBy != null && groupKey != null) {
        values = group(bucket, groupBy).computeIfAbsent(String.valueOf(groupKey), k -> new LinkedHashMap<>());
      }
      for (MetricSpec s : series) {
        Double v = toDouble(row.get(MetricTranslator.alias(s)));
        if (v != null) values.put(seriesName(s), v);
      }
    }

    List<Map<String, Object>> prev = new ArrayList<>(previous.values());
    List<Map<String, Object>> cur = new ArrayList<>(current.values());
    // earlier windows can straddle one more bucket boundary
    if (prev.size() > cur.size()) prev = prev.subList(prev.size() - cur.size(), prev.size());
    return new TimeseriesResult(prev, cur);
  }

  /** {@code index/metric/aggregation[/key]}, or {@code .../pipelineField/pipelineAggregation}; terms reads as cardinality. */
  public static String seriesName(MetricSpec s) {
    String agg = s.aggregation() == AggregationKind.TERMS ? "cardinality" : s.aggregation().id();
    String base = s.index() + "/" + s.field() + "/" + agg;
    if (s.hasPipeline()) return base + "/" + s.pipeline().field() + "/" + s.pipeline().aggregation().id();
    if (s.key() != null) return base + "/" + s.key();
    return base;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Map<String, Object>> group(Map<String, Object> bucket, String groupBy) {
    return (Map<String, Map<String, Object>>) bucket.computeIfAbsent(groupBy, k -> new LinkedHashMap<String, Map<String, Object>>());
  }

  private static Double toDouble(Object v) {
    if (v == null) return null;
    if (v instanceof Number n) return n.doubleValue();
    try {
      return Double.valueOf(v.toString());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
