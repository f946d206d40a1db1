package io.intellixity.insight.clickhouse.fields;

/** The three tables of the analytics schema. Aliases are fixed for every generated query. */
public enum TableId {
  /** One row per trace. */
  TRACE_SUMMARIES("trace_summaries", "ts"),
  /** Many spans per trace. */
  STORED_SPANS("stored_spans", "ss"),
  /** Many evaluation runs per trace. */
  EVALUATION_RUNS("evaluation_runs", "es");

  private final String tableName;
  private final String alias;

  TableId(String tableName, String alias) {
    this.tableName = tableName;
    this.alias = alias;
  }

  public String tableName() { return tableName; }
  public String alias() { return alias; }
  public boolean isPrimary() { return this == TRACE_SUMMARIES; }
}
