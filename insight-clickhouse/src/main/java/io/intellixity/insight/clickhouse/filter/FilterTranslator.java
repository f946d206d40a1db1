package io.intellixity.insight.clickhouse.filter;

import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.clickhouse.fields.TableId;
import io.intellixity.insight.clickhouse.sql.ParamNames;
import io.intellixity.insight.query.FilterEntry;
import io.intellixity.insight.query.FilterSpec;
import io.intellixity.insight.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.intellixity.insight.clickhouse.fields.TableId.*;

/**
 * Filter field + values to a WHERE fragment over {@code trace_summaries ts}.
 * <p>
 * Primary-table filters compare columns directly. Span and evaluation filters are correlated
 * {@code EXISTS} subqueries so a trace with many matching child rows still counts once; filters
 * therefore never require a JOIN. Every value is a bound parameter.
 */
public final class FilterTranslator {
  private static final Logger log = LoggerFactory.getLogger(FilterTranslator.class);

  private final FieldMap fields;

  public FilterTranslator(FieldMap fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  public FilterTranslation translate(FilterEntry entry, ParamNames names) {
    return translate(entry.field(), entry.values(), entry.key(), entry.subkey(), names);
  }

  public FilterTranslation translate(String field, List<String> values, String key, String subkey, ParamNames names) {
    if (values == null || values.isEmpty()) return FilterTranslation.TRIVIAL;
    Optional<FilterField> f = FilterField.fromId(field);
    if (f.isEmpty()) {
      log.debug("Ignoring unknown filter field '{}'", field);
      return FilterTranslation.TRIVIAL;
    }
    return switch (f.get()) {
      case TOPICS -> inList(col("topics.topics"), "topicIds", values, names);
      case SUBTOPICS -> inList(col("topics.subtopics"), "subtopicIds", values, names);
      case USER_ID -> attributeIn(FieldMap.USER_ID_ATTR, values, names);
      case THREAD_ID -> attributeIn(FieldMap.THREAD_ID_ATTR, values, names);
      case CUSTOMER_ID -> attributeIn(FieldMap.CUSTOMER_ID_ATTR, values, names);
      case LABELS -> jsonArrayHasAny(col("metadata.labels"), "labels", values, names);
      case PROMPT_IDS -> jsonArrayHasAny(col("metadata.prompt_ids"), "promptIds", values, names);
      case METADATA_KEY -> metadataKeys(values, names);
      case METADATA_VALUE -> key == null ? FilterTranslation.TRIVIAL : attributeIn(restoreDots(key), values, names);
      case ERROR -> booleanFlag(col("traces.error"), values);
      case HAS_ANNOTATION -> booleanFlag(col("annotations.hasAnnotation"), values);
      case SPAN_TYPE -> childIn(STORED_SPANS, "spans.type", "spanTypes", values, names);
      case SPAN_MODEL -> childIn(STORED_SPANS, "spans.model", "models", values, names);
      case EVALUATOR_ID -> evaluatorIds(values, false, names);
      case EVALUATOR_ID_GUARDRAILS_ONLY -> evaluatorIds(values, true, names);
      case EVALUATION_PASSED -> evaluationPassed(values, key, names);
      case EVALUATION_SCORE -> evaluationScore(values, key, names);
      case EVALUATION_LABEL -> evaluationIn("evaluations.label", "evalLabels", values, key, names);
      case EVALUATION_STATE -> evaluationIn("evaluations.state", "evalStates", values, key, names);
      case EVENT_TYPE -> eventTypes(values, names);
      case EVENT_METRIC_KEY, EVENT_DETAIL_KEY -> eventAttributeKeys(values, key, names);
      case EVENT_METRIC_VALUE -> eventMetricValue(values, key, subkey, names);
    };
  }

  public FilterTranslation translateAll(FilterSpec spec, ParamNames names) {
    if (spec == null) return FilterTranslation.TRIVIAL;
    List<FilterTranslation> out = new ArrayList<>(spec.entries().size());
    for (FilterEntry e : spec.entries()) out.add(translate(e, names));
    return combine(out);
  }

  /** AND of all non-trivial fragments, each parenthesized. */
  public static FilterTranslation combine(List<FilterTranslation> translations) {
    List<String> clauses = new ArrayList<>();
    Set<TableId> joins = EnumSet.noneOf(TableId.class);
    Map<String, Object> params = new LinkedHashMap<>();
    boolean exists = false;
    for (FilterTranslation t : translations) {
      if (t == null || t.isTrivial()) continue;
      clauses.add("(" + t.whereClause() + ")");
      joins.addAll(t.requiredJoins());
      params.putAll(t.params());
      exists |= t.usesExistsSubquery();
    }
    if (clauses.isEmpty()) return FilterTranslation.TRIVIAL;
    return new FilterTranslation(String.join(" AND ", clauses), joins, params, exists);
  }

  // ---- primary table ----

  private FilterTranslation inList(String column, String prefix, List<String> values, ParamNames names) {
    String p = names.next(prefix);
    return FilterTranslation.of(column + " IN ({" + p + ":Array(String)})", Map.of(p, List.copyOf(values)));
  }

  private FilterTranslation attributeIn(String attributeKey, List<String> values, ParamNames names) {
    String p = names.next("metaValues");
    String k = p + "_key";
    Map<String, Object> params = new LinkedHashMap<>();
    params.put(k, attributeKey);
    params.put(p, List.copyOf(values));
    return FilterTranslation.of(alias(TRACE_SUMMARIES) + ".Attributes[{" + k + ":String}] IN ({" + p + ":Array(String)})", params);
  }

  private FilterTranslation jsonArrayHasAny(String column, String prefix, List<String> values, ParamNames names) {
    String p = names.next(prefix);
    return FilterTranslation.of("hasAny(JSONExtract(" + column + ", 'Array(String)'), {" + p + ":Array(String)})",
        Map.of(p, List.copyOf(values)));
  }

  private FilterTranslation metadataKeys(List<String> values, ParamNames names) {
    String p = names.next("metaKeys");
    List<String> keys = new ArrayList<>(values.size());
    for (String v : values) keys.add(restoreDots(v));
    return FilterTranslation.of("arrayExists(k -> mapContains(" + alias(TRACE_SUMMARIES) + ".Attributes, k), {" + p + ":Array(String)})",
        Map.of(p, keys));
  }

  /** true/false flag; both (or neither) requested is no filter at all. */
  private static FilterTranslation booleanFlag(String column, List<String> values) {
    boolean t = values.contains("true");
    boolean f = values.contains("false");
    if (t && !f) return FilterTranslation.of(column + " = 1", Map.of());
    if (f && !t) return FilterTranslation.of("(" + column + " = 0 OR " + column + " IS NULL)", Map.of());
    return FilterTranslation.TRIVIAL;
  }

  // ---- child tables ----

  private FilterTranslation childIn(TableId table, String path, String prefix, List<String> values, ParamNames names) {
    String p = names.next(prefix);
    return exists(table, fields.qualifiedColumn(path) + " IN ({" + p + ":Array(String)})", Map.of(p, List.copyOf(values)));
  }

  private FilterTranslation evaluatorIds(List<String> values, boolean guardrailsOnly, ParamNames names) {
    String p = names.next("evaluatorIds");
    String cond = col("evaluations.evaluator_id") + " IN ({" + p + ":Array(String)})";
    if (guardrailsOnly) cond += "\n    AND " + col("evaluations.guardrail") + " = 1";
    return exists(EVALUATION_RUNS, cond, Map.of(p, List.copyOf(values)));
  }

  private FilterTranslation evaluationPassed(List<String> values, String evaluatorId, ParamNames names) {
    boolean t = false;
    boolean f = false;
    for (String v : values) {
      if ("true".equals(v) || "1".equals(v)) t = true;
      else f = true;
    }
    if (t && f) return FilterTranslation.TRIVIAL;

    Map<String, Object> params = new LinkedHashMap<>();
    String cond = evaluatorCondition(evaluatorId, params, names);
    String p = names.next("evalPassed");
    params.put(p, List.of(t ? 1 : 0));
    return exists(EVALUATION_RUNS, cond + col("evaluations.passed") + " IN ({" + p + ":Array(UInt8)})", params);
  }

  private FilterTranslation evaluationScore(List<String> values, String evaluatorId, ParamNames names) {
    double[] range = range("evaluations.score", values);
    Map<String, Object> params = new LinkedHashMap<>();
    String cond = evaluatorCondition(evaluatorId, params, names);
    String min = names.next("scoreMin");
    String max = names.next("scoreMax");
    params.put(min, range[0]);
    params.put(max, range[1]);
    String score = col("evaluations.score");
    return exists(EVALUATION_RUNS,
        cond + score + " >= {" + min + ":Float64}\n    AND " + score + " <= {" + max + ":Float64}", params);
  }

  private FilterTranslation evaluationIn(String path, String prefix, List<String> values, String evaluatorId, ParamNames names) {
    Map<String, Object> params = new LinkedHashMap<>();
    String cond = evaluatorCondition(evaluatorId, params, names);
    String p = names.next(prefix);
    params.put(p, List.copyOf(values));
    return exists(EVALUATION_RUNS, cond + col(path) + " IN ({" + p + ":Array(String)})", params);
  }

  private String evaluatorCondition(String evaluatorId, Map<String, Object> params, ParamNames names) {
    if (evaluatorId == null) return "";
    String p = names.next("evaluatorId");
    params.put(p, evaluatorId);
    return col("evaluations.evaluator_id") + " = {" + p + ":String}\n    AND ";
  }

  private FilterTranslation eventTypes(List<String> values, ParamNames names) {
    String p = names.next("eventTypes");
    return exists(STORED_SPANS, "hasAny(" + col("events.event_type") + ", {" + p + ":Array(String)})", Map.of(p, List.copyOf(values)));
  }

  /** Name and attributes are correlated by array index, so type and key must match on the same event. */
  private FilterTranslation eventAttributeKeys(List<String> values, String eventType, ParamNames names) {
    Map<String, Object> params = new LinkedHashMap<>();
    String keys = names.next("metricKeys");
    params.put(keys, List.copyOf(values));
    String cond;
    if (eventType != null) {
      String et = names.next("eventType");
      params.put(et, eventType);
      cond = "arrayExists((name, attrs) -> name = {" + et + ":String}"
          + " AND arrayExists(k -> mapContains(attrs, k), {" + keys + ":Array(String)}), "
          + col("events.event_type") + ", " + col("events.attributes") + ")";
    } else {
      cond = "arrayExists(attrs -> arrayExists(k -> mapContains(attrs, k), {" + keys + ":Array(String)}), "
          + col("events.attributes") + ")";
    }
    return exists(STORED_SPANS, cond, params);
  }

  private FilterTranslation eventMetricValue(List<String> values, String eventType, String metricKey, ParamNames names) {
    if (metricKey == null) return FilterTranslation.TRIVIAL;
    double[] range = range("events.metrics.value", values);

    Map<String, Object> params = new LinkedHashMap<>();
    String mk = names.next("metricKey");
    String min = names.next("metricMin");
    String max = names.next("metricMax");
    params.put(mk, metricKey);
    params.put(min, range[0]);
    params.put(max, range[1]);
    String value = "toFloat64OrNull(attrs[{" + mk + ":String}])";
    String inRange = value + " >= {" + min + ":Float64} AND " + value + " <= {" + max + ":Float64}";

    String cond;
    if (eventType != null) {
      String et = names.next("eventType");
      params.put(et, eventType);
      cond = "arrayExists((name, attrs) -> name = {" + et + ":String} AND " + inRange + ", "
          + col("events.event_type") + ", " + col("events.attributes") + ")";
    } else {
      cond = "arrayExists(attrs -> " + inRange + ", " + col("events.attributes") + ")";
    }
    return exists(STORED_SPANS, cond, params);
  }

  private FilterTranslation exists(TableId child, String condition, Map<String, Object> params) {
    String sql = "EXISTS (\n"
        + "  SELECT 1 FROM " + child.tableName() + " " + child.alias() + "\n"
        + "  WHERE " + fields.correlation(child) + "\n"
        + "    AND " + condition + "\n"
        + ")";
    return FilterTranslation.exists(sql, params);
  }

  /**
   * Inclusive [lower, upper]. Exactly two finite numbers are required; anything else is rejected
   * rather than compared as NaN.
   */
  static double[] range(String field, List<String> values) {
    if (values.size() != 2) {
      throw new QueryValidationException("Filter '" + field + "' expects [min, max], got " + values.size() + " value(s)");
    }
    double lo = parseFinite(field, values.get(0));
    double hi = parseFinite(field, values.get(1));
    if (lo > hi) throw new QueryValidationException("Filter '" + field + "' has min > max: " + lo + " > " + hi);
    return new double[] {lo, hi};
  }

  private static double parseFinite(String field, String v) {
    double d;
    try {
      d = Double.parseDouble(v == null ? "" : v.trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Filter '" + field + "' bound is not a number: '" + v + "'", e);
    }
    if (!Double.isFinite(d)) throw new QueryValidationException("Filter '" + field + "' bound is not finite: '" + v + "'");
    return d;
  }

  /** Metadata keys arrive with dots replaced by a middle dot. */
  private static String restoreDots(String key) {
    return key.replace('\u00B7', '.');
  }

  private String col(String path) { return fields.qualifiedColumn(path); }

  private String alias(TableId table) { return fields.tableAlias(table); }
}
