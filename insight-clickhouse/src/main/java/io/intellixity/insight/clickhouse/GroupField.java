package io.intellixity.insight.clickhouse;

import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.clickhouse.fields.TableId;

import java.util.HashMap;
import java.util.Map;

/**
 * Group-by dimensions. Each knows its key expression, the table it lives on and how its
 * values behave (scalar, exploded array, 0/1 flag, or an always-labelled computed key).
 */
public enum GroupField {
  TOPICS("topics.topics", TableId.TRACE_SUMMARIES, Kind.SCALAR, "ts.TopicId"),
  SUBTOPICS("topics.subtopics", TableId.TRACE_SUMMARIES, Kind.SCALAR, "ts.SubTopicId"),
  USER_ID("metadata.user_id", TableId.TRACE_SUMMARIES, Kind.SCALAR, "ts.Attributes['" + FieldMap.USER_ID_ATTR + "']"),
  THREAD_ID("metadata.thread_id", TableId.TRACE_SUMMARIES, Kind.SCALAR, "ts.Attributes['" + FieldMap.THREAD_ID_ATTR + "']"),
  CUSTOMER_ID("metadata.customer_id", TableId.TRACE_SUMMARIES, Kind.SCALAR, "ts.Attributes['" + FieldMap.CUSTOMER_ID_ATTR + "']"),
  LABELS("metadata.labels", TableId.TRACE_SUMMARIES, Kind.ARRAY,
      "arrayJoin(JSONExtract(ts.Attributes['" + FieldMap.LABELS_ATTR + "'], 'Array(String)'))"),
  MODEL("metadata.model", TableId.STORED_SPANS, Kind.SCALAR, "ss.SpanAttributes['" + FieldMap.MODEL_ATTR + "']"),
  SPAN_TYPE("metadata.span_type", TableId.STORED_SPANS, Kind.SCALAR, "ss.SpanAttributes['" + FieldMap.SPAN_TYPE_ATTR + "']"),
  EVALUATION_PASSED("evaluations.evaluation_passed", TableId.EVALUATION_RUNS, Kind.FLAG, "es.Passed"),
  EVALUATION_LABEL("evaluations.evaluation_label", TableId.EVALUATION_RUNS, Kind.SCALAR, "es.Label"),
  EVALUATION_STATE("evaluations.evaluation_processing_state", TableId.EVALUATION_RUNS, Kind.SCALAR, "es.Status"),
  EVENT_TYPE("events.event_type", TableId.STORED_SPANS, Kind.ARRAY, "arrayJoin(ss.\"Events.Name\")"),
  INPUT_SENTIMENT("sentiment.input_sentiment", TableId.TRACE_SUMMARIES, Kind.LABELLED,
      "multiIf(toFloat64OrNull(ts.Attributes['" + FieldMap.SATISFACTION_ATTR + "']) >= 0.1, 'positive', "
          + "toFloat64OrNull(ts.Attributes['" + FieldMap.SATISFACTION_ATTR + "']) <= -0.1, 'negative', 'neutral')"),
  THUMBS_UP_DOWN("sentiment.thumbs_up_down", TableId.STORED_SPANS, Kind.ARRAY,
      "arrayJoin(arrayMap(attrs -> attrs['vote'], "
          + "arrayFilter((attrs, name) -> name = 'thumbs_up_down', ss.\"Events.Attributes\", ss.\"Events.Name\")))"),
  HAS_ERROR("error.has_error", TableId.TRACE_SUMMARIES, Kind.LABELLED,
      "if(ts.ContainsErrorStatus = 1, 'with error', 'without error')"),
  /** Fallback for unknown group-by fields: one group per trace. */
  TRACE("trace_id", TableId.TRACE_SUMMARIES, Kind.SCALAR, "ts.TraceId");

  /** How key values are normalized. */
  public enum Kind {
    /** Missing or empty values become 'unknown'. */
    SCALAR,
    /** One row per element; empty elements are dropped with HAVING. */
    ARRAY,
    /** 0/1, never normalized or filtered. */
    FLAG,
    /** Computed key that always yields a label. */
    LABELLED
  }

  public static final String UNKNOWN = "unknown";

  private static final Map<String, GroupField> BY_ID = new HashMap<>();

  static {
    for (GroupField g : values()) BY_ID.put(g.id, g);
  }

  private final String id;
  private final TableId table;
  private final Kind kind;
  private final String expression;

  GroupField(String id, TableId table, Kind kind, String expression) {
    this.id = id;
    this.table = table;
    this.kind = kind;
    this.expression = expression;
  }

  public String id() { return id; }
  public TableId table() { return table; }
  public Kind kind() { return kind; }
  public String expression() { return expression; }

  /** Array keys and child-table keys fan out per trace, so they need the deduplicated shape. */
  public boolean needsDedup() { return kind == Kind.ARRAY || !table.isPrimary(); }

  public boolean scopedByEvaluator() { return table == TableId.EVALUATION_RUNS; }

  /** Evaluation keys only exist on traces that have runs; an unmatched LEFT JOIN would read as Passed = 0. */
  public boolean requiresChildRow() { return table == TableId.EVALUATION_RUNS; }

  /** {@code group_key} select expression with normalization applied. */
  public String keyExpression() {
    if (kind != Kind.SCALAR) return expression;
    return "if(" + expression + " = '' OR " + expression + " IS NULL, '" + UNKNOWN + "', " + expression + ")";
  }

  public static GroupField resolve(String id) {
    GroupField g = id == null ? null : BY_ID.get(id);
    return g == null ? TRACE : g;
  }

  public static boolean isKnown(String id) { return id != null && BY_ID.containsKey(id); }
}
