package io.intellixity.insight.clickhouse;

import java.util.List;
import java.util.Map;

/**
 * Buckets per period, oldest first. Each bucket maps {@code date} to its bucket start ("full" for
 * summary queries) and each series name to its value; grouped results nest a map of group key to
 * series values under the group-by field.
 */
public record TimeseriesResult(List<Map<String, Object>> previousPeriod, List<Map<String, Object>> currentPeriod) {
  public TimeseriesResult {
    previousPeriod = List.copyOf(previousPeriod);
    currentPeriod = List.copyOf(currentPeriod);
  }
}
