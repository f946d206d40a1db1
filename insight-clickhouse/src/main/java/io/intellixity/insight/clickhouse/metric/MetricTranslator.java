package io.intellixity.insight.clickhouse.metric;

import io.intellixity.insight.clickhouse.fields.ColumnScope;
import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.clickhouse.fields.PrimaryColumn;
import io.intellixity.insight.clickhouse.fields.TableId;
import io.intellixity.insight.clickhouse.sql.ParamNames;
import io.intellixity.insight.query.AggregationKind;
import io.intellixity.insight.query.MetricSpec;
import io.intellixity.insight.query.PipelineSpec;
import io.intellixity.insight.query.UnsupportedMetricException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.intellixity.insight.clickhouse.fields.PrimaryColumn.*;
import static io.intellixity.insight.clickhouse.fields.TableId.*;

/**
 * Metric field + aggregation to a ClickHouse aggregate expression.
 * <p>
 * Scoping keys (evaluator id, event type, metric key) are bound parameters; only the alias
 * carries a sanitized copy. Unknown metrics fall back to counting traces.
 */
public final class MetricTranslator {
  private static final Logger log = LoggerFactory.getLogger(MetricTranslator.class);

  /** Longer threads are treated as idle/abandoned and capped before averaging. */
  public static final long MAX_THREAD_DURATION_MS = 60L * 60 * 1000;

  static final String THREAD_DURATION_METRIC = "threads.average_duration_per_thread";
  static final String PROCESSED = "es.Status = 'processed'";

  private final FieldMap fields;

  public MetricTranslator(FieldMap fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  /** Pipeline specs are wrapped with {@link #translatePipeline}; others are translated in {@code scope}. */
  public MetricTranslation translate(MetricSpec spec, ParamNames names, ColumnScope scope) {
    if (spec.hasPipeline()) return translatePipeline(spec, names);
    return translateSimple(new Ctx(spec, names, scope));
  }

  public MetricTranslation translatePipeline(MetricSpec spec, ParamNames names) {
    PipelineSpec p = Objects.requireNonNull(spec.pipeline(), "pipeline");
    String alias = alias(spec);
    String key = pipelineKey(p.field());
    String outer = aggregateIf(outerAggregation(p.aggregation()), "inner_value", "pipeline_key != ''", false);

    if (THREAD_DURATION_METRIC.equals(spec.field())) {
      String perBucket = threadAggregation(spec.aggregation());
      SubqueryDescriptor threads = new SubqueryDescriptor(
          key + " AS pipeline_key, " + THREAD_ID.raw() + " AS thread_id, " + threadDuration() + " AS thread_duration",
          "pipeline_key, thread_id",
          perBucket,
          null);
      SubqueryDescriptor top = new SubqueryDescriptor(
          "pipeline_key, " + perBucket + " AS inner_value", "pipeline_key", outer, threads);
      return new MetricTranslation(outer, alias, Set.of(), Map.of(), top);
    }

    MetricSpec innerSpec = new MetricSpec(spec.index(), spec.field(), spec.aggregation(), spec.key(), spec.subkey(), null);
    MetricTranslation inner = translateSimple(new Ctx(innerSpec, names, ColumnScope.RAW));
    SubqueryDescriptor top = SubqueryDescriptor.twoLevel(
        key + " AS pipeline_key, " + inner.expression() + " AS inner_value", "pipeline_key", outer);
    return new MetricTranslation(outer, alias, inner.requiredJoins(), inner.params(), top);
  }

  /** {@code index__field__aggregation[__key][__subkey]}, restricted to [A-Za-z0-9_]. */
  public static String alias(MetricSpec spec) {
    StringBuilder sb = new StringBuilder();
    sb.append(spec.index()).append("__").append(sanitize(spec.field())).append("__").append(spec.aggregation().id());
    if (spec.key() != null) sb.append("__").append(sanitize(spec.key()));
    if (spec.subkey() != null) sb.append("__").append(sanitize(spec.subkey()));
    return sb.toString();
  }

  private MetricTranslation translateSimple(Ctx c) {
    return switch (MetricCategory.of(c.spec.field())) {
      case METADATA -> metadata(c);
      case PERFORMANCE -> performance(c);
      case EVALUATIONS -> evaluation(c);
      case EVENTS -> event(c);
      case SENTIMENT -> sentiment(c);
      case THREADS -> threads(c);
      case OTHER -> fallback(c);
    };
  }

  // ---- categories ----

  private MetricTranslation metadata(Ctx c) {
    AggregationKind agg = c.spec.aggregation();
    return switch (c.spec.field()) {
      case "metadata.trace_id" -> c.done(aggregate(agg, c.col(TRACE_ID), false));
      case "metadata.user_id" -> c.done(identifier(agg, c.col(USER_ID)));
      case "metadata.thread_id" -> c.done(identifier(agg, c.col(THREAD_ID)));
      case "metadata.customer_id" -> c.done(identifier(agg, c.col(CUSTOMER_ID)));
      case "metadata.span_type" -> c.join(STORED_SPANS).done("uniq(" + fields.qualifiedColumn("spans.span_id") + ")");
      default -> fallback(c);
    };
  }

  private MetricTranslation performance(Ctx c) {
    AggregationKind agg = c.spec.aggregation();
    return switch (c.spec.field()) {
      case "performance.completion_time" -> c.done(aggregate(agg, c.col(TOTAL_DURATION_MS), true));
      case "performance.first_token" -> c.done(aggregate(agg, c.col(TIME_TO_FIRST_TOKEN_MS), true));
      case "performance.total_cost" -> c.done(aggregate(agg, c.col(TOTAL_COST), false));
      case "performance.prompt_tokens" -> c.done(aggregate(agg, c.col(PROMPT_TOKENS), false));
      case "performance.completion_tokens" -> c.done(aggregate(agg, c.col(COMPLETION_TOKENS), false));
      case "performance.total_tokens" -> c.done(aggregate(agg,
          "(coalesce(" + c.col(PROMPT_TOKENS) + ", 0) + coalesce(" + c.col(COMPLETION_TOKENS) + ", 0))", false));
      case "performance.tokens_per_second" -> c.done(aggregate(agg, c.col(TOKENS_PER_SECOND), false));
      default -> fallback(c);
    };
  }

  private MetricTranslation evaluation(Ctx c) {
    AggregationKind agg = c.spec.aggregation();
    String field = c.spec.field();
    if (!field.equals("evaluations.evaluation_score")
        && !field.equals("evaluations.evaluation_pass_rate")
        && !field.equals("evaluations.evaluation_runs")) {
      return fallback(c);
    }

    c.join(EVALUATION_RUNS);
    String evaluator = c.spec.key() == null
        ? null
        : fields.qualifiedColumn("evaluations.evaluator_id") + " = " + c.bind("evaluatorId", "String", c.spec.key());

    if (field.equals("evaluations.evaluation_runs")) {
      String id = fields.qualifiedColumn("evaluations.evaluation_id");
      String cond = id + " != ''" + (evaluator == null ? "" : " AND " + evaluator);
      return c.done("uniqIf(" + id + ", " + cond + ")");
    }

    String cond = (evaluator == null ? "" : evaluator + " AND ") + PROCESSED;
    String value = field.equals("evaluations.evaluation_score")
        ? fields.qualifiedColumn("evaluations.score")
        : "toFloat64(" + fields.qualifiedColumn("evaluations.passed") + ")";
    return c.done(aggregateIf(agg, value, cond, false));
  }

  private MetricTranslation event(Ctx c) {
    String names = fields.qualifiedColumn("events.event_type");
    String attrs = fields.qualifiedColumn("events.attributes");
    switch (c.spec.field()) {
      case "events.event_type": {
        c.join(STORED_SPANS);
        if (c.spec.key() == null) return c.done("coalesce(sum(length(" + names + ")), 0)");
        String et = c.bind("eventType", "String", c.spec.key());
        return c.done("coalesce(sum(arrayCount(n -> n = " + et + ", " + names + ")), 0)");
      }
      case "events.event_score": {
        if (c.spec.key() == null || c.spec.subkey() == null) {
          log.debug("Metric '{}' has no event type or metric key, counting traces", c.spec.field());
          return fallback(c);
        }
        c.join(STORED_SPANS);
        String et = c.bind("eventType", "String", c.spec.key());
        String mk = c.bind("metricKey", "String", c.spec.subkey());
        String values = "arrayMap(attrs -> toFloat64OrNull(attrs[" + mk + "]), "
            + "arrayFilter((attrs, name) -> name = " + et + ", " + attrs + ", " + names + "))";
        return c.done(aggregateArray(c.spec.aggregation(), values));
      }
      case "events.event_details":
        throw new UnsupportedMetricException(c.spec.field(), "event detail aggregations have no SQL translation");
      default:
        return fallback(c);
    }
  }

  private MetricTranslation sentiment(Ctx c) {
    AggregationKind agg = c.spec.aggregation();
    switch (c.spec.field()) {
      case "sentiment.input_sentiment":
        return c.done(aggregate(agg, "toFloat64OrNull(" + c.col(SATISFACTION_SCORE) + ")", false));
      case "sentiment.thumbs_up_down": {
        c.join(STORED_SPANS);
        String votes = "arrayMap(attrs -> toFloat64OrNull(attrs['vote']), "
            + "arrayFilter((attrs, name) -> name = 'thumbs_up_down', "
            + fields.qualifiedColumn("events.attributes") + ", " + fields.qualifiedColumn("events.event_type") + "))";
        return c.done(aggregateArray(agg, votes));
      }
      default:
        return fallback(c);
    }
  }

  private MetricTranslation threads(Ctx c) {
    if (!THREAD_DURATION_METRIC.equals(c.spec.field())) return fallback(c);
    String outer = threadAggregation(c.spec.aggregation());
    SubqueryDescriptor d = SubqueryDescriptor.twoLevel(
        THREAD_ID.raw() + " AS thread_id, " + threadDuration() + " AS thread_duration", "thread_id", outer);
    return c.subquery(outer, d);
  }

  private MetricTranslation fallback(Ctx c) {
    log.debug("No translation for metric '{}', counting traces", c.spec.field());
    return c.done(c.scope == ColumnScope.DEDUPED ? "uniq(" + TRACE_ID.carriedName() + ")" : "count()");
  }

  // ---- aggregate rendering ----

  /** Distinct counts over user/thread/customer ids skip traces without the id. */
  private static String identifier(AggregationKind agg, String column) {
    if (agg.isDistinctCount()) return "uniqIf(" + column + ", " + column + " != '')";
    return aggregate(agg, column, false);
  }

  /** Per-thread wall time, capped at the innermost level. */
  private static String threadDuration() {
    String created = CREATED_AT.raw();
    return "least(dateDiff('millisecond', min(" + created + "), max(" + created + ")), " + MAX_THREAD_DURATION_MS + ")";
  }

  private static String threadAggregation(AggregationKind agg) {
    return aggregateIf(agg, "thread_duration", "thread_id != ''", true);
  }

  private static String pipelineKey(String field) {
    switch (field) {
      case "trace_id": return TRACE_ID.raw();
      case "user_id": return USER_ID.raw();
      case "thread_id": return THREAD_ID.raw();
      case "customer_id": return CUSTOMER_ID.raw();
      default:
        log.debug("Unknown pipeline field '{}', bucketing per trace", field);
        return TRACE_ID.raw();
    }
  }

  private static AggregationKind outerAggregation(AggregationKind k) {
    return switch (k) {
      case AVG, SUM, MIN, MAX -> k;
      default -> AggregationKind.MAX;
    };
  }

  static String aggregate(AggregationKind agg, String x, boolean exact) {
    return switch (agg) {
      case AVG -> "avg(" + x + ")";
      case SUM -> "coalesce(sum(" + x + "), 0)";
      case MIN -> "min(" + x + ")";
      case MAX -> "max(" + x + ")";
      case CARDINALITY, TERMS -> "uniq(" + x + ")";
      case MEDIAN, P90, P95, P99 -> quantile(agg, exact, "") + "(" + x + ")";
    };
  }

  static String aggregateIf(AggregationKind agg, String x, String cond, boolean exact) {
    return switch (agg) {
      case AVG -> "avgIf(" + x + ", " + cond + ")";
      case SUM -> "coalesce(sumIf(" + x + ", " + cond + "), 0)";
      case MIN -> "minIf(" + x + ", " + cond + ")";
      case MAX -> "maxIf(" + x + ", " + cond + ")";
      case CARDINALITY, TERMS -> "uniqIf(" + x + ", " + cond + ")";
      case MEDIAN, P90, P95, P99 -> quantile(agg, exact, "If") + "(" + x + ", " + cond + ")";
    };
  }

  /** Aggregates over the elements of an array column ({@code -Array} combinator). */
  static String aggregateArray(AggregationKind agg, String arr) {
    return switch (agg) {
      case AVG -> "avgArray(" + arr + ")";
      case SUM -> "coalesce(sumArray(" + arr + "), 0)";
      case MIN -> "minArray(" + arr + ")";
      case MAX -> "maxArray(" + arr + ")";
      case CARDINALITY, TERMS -> "uniqArray(" + arr + ")";
      case MEDIAN, P90, P95, P99 -> quantile(agg, false, "Array") + "(" + arr + ")";
    };
  }

  private static String quantile(AggregationKind agg, boolean exact, String combinator) {
    return (exact ? "quantileExact" : "quantileTDigest") + combinator + "(" + agg.percentile() + ")";
  }

  private static String sanitize(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
      sb.append(ok ? ch : '_');
    }
    return sb.toString();
  }

  /** Per-series translation state. */
  private static final class Ctx {
    final MetricSpec spec;
    final ParamNames names;
    final ColumnScope scope;
    final String alias;
    final Set<TableId> joins = EnumSet.noneOf(TableId.class);
    final Map<String, Object> params = new LinkedHashMap<>();

    Ctx(MetricSpec spec, ParamNames names, ColumnScope scope) {
      this.spec = spec;
      this.names = names;
      this.scope = scope;
      this.alias = alias(spec);
    }

    String col(PrimaryColumn c) { return scope.column(c); }

    Ctx join(TableId t) { joins.add(t); return this; }

    String bind(String prefix, String type, Object value) {
      ParamNames.Placeholder p = names.placeholder(prefix, type);
      params.put(p.name(), value);
      return p.sql();
    }

    MetricTranslation done(String expression) {
      return new MetricTranslation(expression, alias, joins, params, null);
    }

    MetricTranslation subquery(String expression, SubqueryDescriptor d) {
      return new MetricTranslation(expression, alias, joins, params, d);
    }
  }
}
