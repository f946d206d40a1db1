package io.intellixity.insight.clickhouse;

import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.clickhouse.fields.TableId;
import io.intellixity.insight.clickhouse.filter.FilterField;
import io.intellixity.insight.clickhouse.filter.FilterTranslation;
import io.intellixity.insight.clickhouse.filter.FilterTranslator;
import io.intellixity.insight.clickhouse.sql.ParamNames;
import io.intellixity.insight.clickhouse.sql.SelectBuilder;
import io.intellixity.insight.compile.BuiltQuery;
import io.intellixity.insight.compile.TopDocumentsQuery;
import io.intellixity.insight.query.FilterOptionsRequest;
import io.intellixity.insight.query.FilterSpec;
import io.intellixity.insight.util.AnalyticsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.intellixity.insight.clickhouse.AggregationBuilder.PRIMARY_FROM;
import static io.intellixity.insight.clickhouse.fields.TableId.EVALUATION_RUNS;
import static io.intellixity.insight.clickhouse.fields.TableId.STORED_SPANS;

/** Non-timeseries queries: filter dropdown options, top RAG documents, feedback events. */
final class AuxiliaryQueries {
  private static final Logger log = LoggerFactory.getLogger(AuxiliaryQueries.class);

  static final String EMPTY_OPTIONS = "SELECT '' AS field, '' AS label, 0 AS count WHERE 1 = 0";

  private static final String RANGE = "ts.CreatedAt >= {startDate:DateTime64(3)} AND ts.CreatedAt < {endDate:DateTime64(3)}";

  /** How one filter field is listed. {@code join} and {@code search} may be null. */
  private record OptionSource(String field, String label, TableId join, String where, String having,
                              String groupBy, String search) {
    static OptionSource column(String expr) {
      return new OptionSource(expr, expr, null, expr + " != ''", null, "field", expr);
    }

    static OptionSource exploded(String expr, TableId join) {
      return new OptionSource(expr, "field", join, null, "field != ''", "field", "field");
    }

    static OptionSource flag(String column, String yes, String no) {
      return new OptionSource("if(" + column + " = 1, 'true', 'false')",
          "if(" + column + " = 1, '" + yes + "', '" + no + "')", null, null, null, "field, label", null);
    }

    OptionSource joining(TableId table) {
      return new OptionSource(field, label, table, where, having, groupBy, search);
    }

    OptionSource and(String predicate) {
      return new OptionSource(field, label, join, where == null ? predicate : where + " AND " + predicate, having, groupBy, search);
    }
  }

  private final FieldMap fields;
  private final FilterTranslator filters;
  private final AnalyticsSettings settings;

  AuxiliaryQueries(FieldMap fields, FilterTranslator filters, AnalyticsSettings settings) {
    this.fields = fields;
    this.filters = filters;
    this.settings = settings;
  }

  BuiltQuery filterOptions(FilterOptionsRequest r) {
    ParamNames names = new ParamNames();
    Map<String, Object> params = baseParams(r.tenantId(), r.start(), r.end());
    OptionSource src = FilterField.fromId(r.field()).map(f -> source(f, r.key(), names, params)).orElse(null);
    if (src == null) {
      log.debug("No option listing for filter field '{}'", r.field());
      return new BuiltQuery(EMPTY_OPTIONS, Map.of());
    }

    SelectBuilder b = new SelectBuilder()
        .select(src.field() + " AS field")
        .select(src.label() + " AS label")
        .select("count() AS count")
        .from(PRIMARY_FROM);
    if (src.join() != null) b.join(fields.innerJoinClause(src.join()));
    b.where(AggregationBuilder.tenant()).where(RANGE).where(src.where());

    if (r.query() != null && src.search() != null) {
      b.where(src.search() + " ILIKE {searchQuery:String}");
      params.put("searchQuery", "%" + r.query() + "%");
    }
    FilterTranslation extra = filters.translateAll(r.filters(), names);
    b.where(extra.whereClause());
    params.putAll(extra.params());

    b.groupBy(src.groupBy());
    if (src.having() != null) b.having(src.having());
    String sql = b.orderBy("count DESC").limit(settings.filterOptionLimit()).toSql();
    log.debug("Filter options query for {}: {}", r.field(), sql);
    return new BuiltQuery(sql, params).requireResolved();
  }

  private OptionSource source(FilterField f, String key, ParamNames names, Map<String, Object> params) {
    return switch (f) {
      case TOPICS -> OptionSource.column("ts.TopicId");
      case SUBTOPICS -> OptionSource.column("ts.SubTopicId");
      case USER_ID -> OptionSource.column(fields.qualifiedColumn("metadata.user_id"));
      case THREAD_ID -> OptionSource.column(fields.qualifiedColumn("metadata.thread_id"));
      case CUSTOMER_ID -> OptionSource.column(fields.qualifiedColumn("metadata.customer_id"));
      case LABELS -> OptionSource.exploded(jsonArray(FieldMap.LABELS_ATTR), null);
      case PROMPT_IDS -> OptionSource.exploded(jsonArray(FieldMap.PROMPT_IDS_ATTR), null);
      case METADATA_KEY -> OptionSource.exploded("arrayJoin(mapKeys(ts.Attributes))", null);
      case METADATA_VALUE -> {
        if (key == null) yield null;
        ParamNames.Placeholder p = names.placeholder("metaKey", "String");
        params.put(p.name(), key);
        yield OptionSource.column("ts.Attributes[" + p.sql() + "]");
      }
      case SPAN_MODEL -> OptionSource.column("ss.SpanAttributes['" + FieldMap.MODEL_ATTR + "']").joining(STORED_SPANS);
      case SPAN_TYPE -> OptionSource.column("ss.SpanAttributes['" + FieldMap.SPAN_TYPE_ATTR + "']").joining(STORED_SPANS);
      case EVALUATOR_ID, EVALUATOR_ID_GUARDRAILS_ONLY -> {
        OptionSource s = new OptionSource("es.EvaluatorId",
            "concat('[', if(es.EvaluatorType = '', 'custom', es.EvaluatorType), '] ', es.EvaluatorName)",
            EVALUATION_RUNS, "es.EvaluatorId != ''", null,
            "es.EvaluatorId, es.EvaluatorType, es.EvaluatorName", "es.EvaluatorName");
        yield f == FilterField.EVALUATOR_ID_GUARDRAILS_ONLY ? s.and("es.IsGuardrail = 1") : s;
      }
      case EVALUATION_LABEL -> evaluatorScoped(OptionSource.column("es.Label"), key, names, params);
      case EVALUATION_STATE -> evaluatorScoped(OptionSource.column("es.Status"), key, names, params);
      case EVENT_TYPE -> OptionSource.exploded("arrayJoin(ss.\"Events.Name\")", STORED_SPANS);
      case ERROR -> OptionSource.flag("ts.ContainsErrorStatus", "Traces with error", "Traces without error");
      case HAS_ANNOTATION -> OptionSource.flag("ts.HasAnnotation", "Traces with annotation", "Traces without annotation");
      case EVALUATION_PASSED, EVALUATION_SCORE, EVENT_METRIC_KEY, EVENT_METRIC_VALUE, EVENT_DETAIL_KEY -> null;
    };
  }

  private static String jsonArray(String attribute) {
    return "arrayJoin(JSONExtract(ts.Attributes['" + attribute + "'], 'Array(String)'))";
  }

  private static OptionSource evaluatorScoped(OptionSource s, String key, ParamNames names, Map<String, Object> params) {
    s = s.joining(EVALUATION_RUNS);
    if (key == null) return s;
    ParamNames.Placeholder p = names.placeholder("evaluatorId", "String");
    params.put(p.name(), key);
    return s.and("es.EvaluatorId = " + p.sql());
  }

  TopDocumentsQuery topDocuments(String tenantId, Instant start, Instant end, FilterSpec filter) {
    ParamNames names = new ParamNames();
    Map<String, Object> params = baseParams(tenantId, start, end);
    FilterTranslation f = filters.translateAll(filter, names);
    params.putAll(f.params());

    SelectBuilder refs = documentRefs(f)
        .select("ts.TraceId AS trace_id")
        .select("JSONExtractString(context, 'document_id') AS document_id")
        .select("JSONExtractString(context, 'content') AS content");
    String documents = new SelectBuilder()
        .with("document_refs", refs.toSql())
        .select("document_id AS documentId")
        .select("count() AS count")
        .select("any(trace_id) AS traceId")
        .select("any(content) AS content")
        .from("document_refs")
        .where("document_id != ''")
        .groupBy("document_id")
        .orderBy("count DESC")
        .limit(settings.topDocumentsLimit())
        .toSql();
    String total = documentRefs(f)
        .select("uniqIf(JSONExtractString(context, 'document_id'), JSONExtractString(context, 'document_id') != '') AS total")
        .toSql();
    log.debug("Top documents query: {}", documents);
    return new TopDocumentsQuery(
        new BuiltQuery(documents, params).requireResolved(),
        new BuiltQuery(total, params).requireResolved());
  }

  private SelectBuilder documentRefs(FilterTranslation f) {
    String contexts = "ss.SpanAttributes['" + FieldMap.RAG_CONTEXTS_ATTR + "']";
    return new SelectBuilder()
        .from(PRIMARY_FROM)
        .join(fields.innerJoinClause(STORED_SPANS))
        .join("ARRAY JOIN JSONExtractArrayRaw(" + contexts + ") AS context")
        .where(AggregationBuilder.tenant())
        .where(RANGE)
        .where(contexts + " != ''")
        .where(f.whereClause());
  }

  BuiltQuery feedbackEvents(String tenantId, Instant start, Instant end, FilterSpec filter) {
    ParamNames names = new ParamNames();
    Map<String, Object> params = baseParams(tenantId, start, end);
    FilterTranslation f = filters.translateAll(filter, names);
    params.putAll(f.params());

    String sql = new SelectBuilder()
        .select("ts.TraceId AS trace_id")
        .select("ss.SpanId AS span_id")
        .select("toUnixTimestamp64Milli(event_timestamp) AS timestamp")
        .select("event_name")
        .select("event_attrs")
        .from(PRIMARY_FROM)
        .join(fields.innerJoinClause(STORED_SPANS))
        .join("ARRAY JOIN ss.\"Events.Timestamp\" AS event_timestamp, ss.\"Events.Name\" AS event_name, "
            + "ss.\"Events.Attributes\" AS event_attrs")
        .where(AggregationBuilder.tenant())
        .where(RANGE)
        .where("event_name = 'thumbs_up_down'")
        .where("mapContains(event_attrs, 'feedback')")
        .where(f.whereClause())
        .orderBy("event_timestamp DESC")
        .limit(settings.feedbackEventsLimit())
        .toSql();
    log.debug("Feedback events query: {}", sql);
    return new BuiltQuery(sql, params).requireResolved();
  }

  private static Map<String, Object> baseParams(String tenantId, Instant start, Instant end) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("tenantId", tenantId);
    params.put("startDate", start);
    params.put("endDate", end);
    return params;
  }
}
