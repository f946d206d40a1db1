package io.intellixity.insight.clickhouse.fields;

/**
 * Primary-table columns that metrics read. In the deduplicated grouping CTE each one is
 * carried under {@link #carriedName()} so metrics can aggregate over distinct traces.
 */
public enum PrimaryColumn {
  TRACE_ID("TraceId", "trace_id"),
  CREATED_AT("CreatedAt", "created_at"),
  TOTAL_DURATION_MS("TotalDurationMs", "total_duration_ms"),
  TIME_TO_FIRST_TOKEN_MS("TimeToFirstTokenMs", "time_to_first_token_ms"),
  TOTAL_COST("TotalCost", "total_cost"),
  PROMPT_TOKENS("TotalPromptTokenCount", "prompt_tokens"),
  COMPLETION_TOKENS("TotalCompletionTokenCount", "completion_tokens"),
  TOKENS_PER_SECOND("TokensPerSecond", "tokens_per_second"),
  USER_ID("Attributes['" + FieldMap.USER_ID_ATTR + "']", "user_id"),
  THREAD_ID("Attributes['" + FieldMap.THREAD_ID_ATTR + "']", "thread_id"),
  CUSTOMER_ID("Attributes['" + FieldMap.CUSTOMER_ID_ATTR + "']", "customer_id"),
  SATISFACTION_SCORE("Attributes['" + FieldMap.SATISFACTION_ATTR + "']", "satisfaction_score");

  private final String column;
  private final String carriedName;

  PrimaryColumn(String column, String carriedName) {
    this.column = column;
    this.carriedName = carriedName;
  }

  public String column() { return column; }
  public String carriedName() { return carriedName; }

  /** {@code ts.<column>} */
  public String raw() { return FieldMap.qualify(TableId.TRACE_SUMMARIES.alias(), column); }

  /** Select item that carries this column into the deduplicated CTE. */
  public String carriedSelectItem() { return raw() + " AS " + carriedName; }
}
