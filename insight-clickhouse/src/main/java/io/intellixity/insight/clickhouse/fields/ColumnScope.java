package io.intellixity.insight.clickhouse.fields;

/** Where metric expressions read primary-table columns from. */
public enum ColumnScope {
  /** The raw {@code trace_summaries ts} row, optionally joined with child tables. */
  RAW,
  /** The {@code deduped} CTE: one row per (trace, group key, period, date). Child tables are joined in their own CTE. */
  DEDUPED;

  public String column(PrimaryColumn c) {
    return this == RAW ? c.raw() : c.carriedName();
  }
}
