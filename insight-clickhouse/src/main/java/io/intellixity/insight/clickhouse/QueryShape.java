package io.intellixity.insight.clickhouse;

/** The four layouts a timeseries query can take. */
public enum QueryShape {
  /** DISTINCT (trace, group key, period, date) CTE, then aggregate. Array or child-table group keys. */
  DEDUPLICATED_GROUPING,
  /** Per-period CTEs, one per multi-level metric plus one for the simple ones; full granularity only. */
  SUBQUERY,
  /** Same layout as {@link #SUBQUERY} with simple metrics only, so both periods always yield a row. */
  SUMMARY,
  /** Single GROUP BY period[, date][, group_key]. */
  BUCKETED
}
