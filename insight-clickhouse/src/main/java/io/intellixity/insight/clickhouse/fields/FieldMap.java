package io.intellixity.insight.clickhouse.fields;

import java.util.*;

import static io.intellixity.insight.clickhouse.fields.MapValueKind.*;
import static io.intellixity.insight.clickhouse.fields.TableId.*;

/**
 * Logical dotted field paths to physical columns. Immutable; {@link #standard()} is shared across threads.
 * <p>
 * Unknown paths resolve to the snake-cased last path segment as a primary-table column.
 * That fallback is restricted to {@code [a-z0-9_]} so it can be rendered as an identifier.
 */
public final class FieldMap {
  public static final String USER_ID_ATTR = "langwatch.user_id";
  public static final String THREAD_ID_ATTR = "gen_ai.conversation.id";
  public static final String CUSTOMER_ID_ATTR = "langwatch.customer_id";
  public static final String LABELS_ATTR = "langwatch.labels";
  public static final String PROMPT_IDS_ATTR = "langwatch.prompt_ids";
  public static final String SATISFACTION_ATTR = "langwatch.input.satisfaction_score";
  public static final String SPAN_TYPE_ATTR = "langwatch.span.type";
  public static final String MODEL_ATTR = "gen_ai.request.model";
  public static final String RAG_CONTEXTS_ATTR = "langwatch.rag.contexts";

  private static final FieldMap STANDARD = new FieldMap(List.of(
      column("trace_id", TRACE_SUMMARIES, "TraceId", STRING),
      column("metadata.trace_id", TRACE_SUMMARIES, "TraceId", STRING),
      column("created_at", TRACE_SUMMARIES, "CreatedAt", NUMBER),
      attribute("metadata.user_id", TRACE_SUMMARIES, "Attributes", USER_ID_ATTR, STRING),
      attribute("metadata.thread_id", TRACE_SUMMARIES, "Attributes", THREAD_ID_ATTR, STRING),
      attribute("metadata.customer_id", TRACE_SUMMARIES, "Attributes", CUSTOMER_ID_ATTR, STRING),
      attribute("metadata.labels", TRACE_SUMMARIES, "Attributes", LABELS_ATTR, JSON_ARRAY),
      attribute("metadata.prompt_ids", TRACE_SUMMARIES, "Attributes", PROMPT_IDS_ATTR, JSON_ARRAY),
      attribute("metadata.span_type", STORED_SPANS, "SpanAttributes", SPAN_TYPE_ATTR, STRING),
      attribute("metadata.model", STORED_SPANS, "SpanAttributes", MODEL_ATTR, STRING),
      attribute("spans.type", STORED_SPANS, "SpanAttributes", SPAN_TYPE_ATTR, STRING),
      attribute("spans.model", STORED_SPANS, "SpanAttributes", MODEL_ATTR, STRING),
      attribute("spans.rag_contexts", STORED_SPANS, "SpanAttributes", RAG_CONTEXTS_ATTR, JSON_ARRAY),
      column("spans.span_id", STORED_SPANS, "SpanId", STRING),
      column("spans.status_code", STORED_SPANS, "StatusCode", NUMBER),
      column("topics.topics", TRACE_SUMMARIES, "TopicId", STRING),
      column("topics.subtopics", TRACE_SUMMARIES, "SubTopicId", STRING),
      column("performance.completion_time", TRACE_SUMMARIES, "TotalDurationMs", NUMBER),
      column("performance.first_token", TRACE_SUMMARIES, "TimeToFirstTokenMs", NUMBER),
      column("performance.total_cost", TRACE_SUMMARIES, "TotalCost", NUMBER),
      column("performance.prompt_tokens", TRACE_SUMMARIES, "TotalPromptTokenCount", NUMBER),
      column("performance.completion_tokens", TRACE_SUMMARIES, "TotalCompletionTokenCount", NUMBER),
      column("performance.tokens_per_second", TRACE_SUMMARIES, "TokensPerSecond", NUMBER),
      column("traces.error", TRACE_SUMMARIES, "ContainsErrorStatus", NUMBER),
      column("annotations.hasAnnotation", TRACE_SUMMARIES, "HasAnnotation", NUMBER),
      attribute("sentiment.input_sentiment", TRACE_SUMMARIES, "Attributes", SATISFACTION_ATTR, NUMBER),
      column("evaluations.evaluation_id", EVALUATION_RUNS, "EvaluationId", STRING),
      column("evaluations.evaluator_id", EVALUATION_RUNS, "EvaluatorId", STRING),
      column("evaluations.evaluator_name", EVALUATION_RUNS, "EvaluatorName", STRING),
      column("evaluations.evaluator_type", EVALUATION_RUNS, "EvaluatorType", STRING),
      column("evaluations.guardrail", EVALUATION_RUNS, "IsGuardrail", NUMBER),
      column("evaluations.score", EVALUATION_RUNS, "Score", NUMBER),
      column("evaluations.passed", EVALUATION_RUNS, "Passed", NUMBER),
      column("evaluations.label", EVALUATION_RUNS, "Label", STRING),
      column("evaluations.state", EVALUATION_RUNS, "Status", STRING),
      new FieldMapping("events.event_type", STORED_SPANS, "\"Events.Name\"", true, false, STRING),
      new FieldMapping("events.attributes", STORED_SPANS, "\"Events.Attributes\"", true, true, STRING),
      new FieldMapping("events.timestamp", STORED_SPANS, "\"Events.Timestamp\"", true, false, NUMBER)
  ));

  private final Map<String, FieldMapping> byPath;

  FieldMap(List<FieldMapping> mappings) {
    Map<String, FieldMapping> m = new LinkedHashMap<>();
    for (FieldMapping fm : mappings) {
      if (m.putIfAbsent(fm.logicalPath(), fm) != null) {
        throw new IllegalArgumentException("Duplicate field mapping: " + fm.logicalPath());
      }
    }
    this.byPath = Collections.unmodifiableMap(m);
  }

  public static FieldMap standard() { return STANDARD; }

  public boolean isKnown(String path) { return path != null && byPath.containsKey(path); }

  public FieldMapping resolve(String path) {
    FieldMapping m = path == null ? null : byPath.get(path);
    if (m != null) return m;
    return new FieldMapping(path == null ? "" : path, TRACE_SUMMARIES, fallbackColumn(path), false, false, STRING);
  }

  public String tableAlias(TableId table) { return table.alias(); }

  /** {@code LEFT JOIN child alias ON tenant and trace equality}; empty for the primary table. */
  public String joinClause(TableId table) {
    if (table.isPrimary()) return "";
    return "LEFT JOIN " + table.tableName() + " " + table.alias() + " ON " + correlation(table);
  }

  /** {@code INNER JOIN} variant for queries that only make sense on traces having child rows. */
  public String innerJoinClause(TableId table) {
    if (table.isPrimary()) return "";
    return "INNER JOIN " + table.tableName() + " " + table.alias() + " ON " + correlation(table);
  }

  /** Tenant and trace equality between a child table and the primary table. */
  public String correlation(TableId table) {
    String c = table.alias();
    String p = TRACE_SUMMARIES.alias();
    return c + ".TenantId = " + p + ".TenantId AND " + c + ".TraceId = " + p + ".TraceId";
  }

  /** {@code ts.TopicId}, {@code ts.Attributes['langwatch.user_id']}. */
  public String qualifiedColumn(String path) {
    FieldMapping m = resolve(path);
    return qualify(m.table().alias(), m.columnExpr());
  }

  /** Qualify the column that carries the map access, not the whole expression. */
  static String qualify(String alias, String expr) {
    int bracket = expr.indexOf('[');
    if (bracket < 0) return alias + "." + expr;
    int start = bracket;
    while (start > 0 && isIdentPart(expr.charAt(start - 1))) start--;
    return expr.substring(0, start) + alias + "." + expr.substring(start);
  }

  static String fallbackColumn(String path) {
    if (path == null || path.isBlank()) return "trace_id";
    String last = path.substring(path.lastIndexOf('.') + 1);
    StringBuilder sb = new StringBuilder(last.length() + 4);
    for (int i = 0; i < last.length(); i++) {
      char c = last.charAt(i);
      if (Character.isUpperCase(c)) {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') sb.append('_');
        sb.append(Character.toLowerCase(c));
      } else if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    String s = sb.toString();
    if (s.isEmpty() || Character.isDigit(s.charAt(0))) s = "_" + s;
    return s;
  }

  private static FieldMapping column(String path, TableId table, String column, MapValueKind kind) {
    return new FieldMapping(path, table, column, false, false, kind);
  }

  private static FieldMapping attribute(String path, TableId table, String mapColumn, String key, MapValueKind kind) {
    return new FieldMapping(path, table, mapColumn + "['" + key + "']", kind == JSON_ARRAY, true, kind);
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
