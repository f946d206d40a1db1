package io.intellixity.insight.clickhouse;

import io.intellixity.insight.clickhouse.fields.ColumnScope;
import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.clickhouse.fields.PrimaryColumn;
import io.intellixity.insight.clickhouse.fields.TableId;
import io.intellixity.insight.clickhouse.filter.FilterTranslation;
import io.intellixity.insight.clickhouse.filter.FilterTranslator;
import io.intellixity.insight.clickhouse.metric.MetricTranslation;
import io.intellixity.insight.clickhouse.metric.MetricTranslator;
import io.intellixity.insight.clickhouse.metric.SubqueryDescriptor;
import io.intellixity.insight.clickhouse.sql.ParamNames;
import io.intellixity.insight.clickhouse.sql.SelectBuilder;
import io.intellixity.insight.compile.BuiltQuery;
import io.intellixity.insight.compile.TopDocumentsQuery;
import io.intellixity.insight.query.FilterOptionsRequest;
import io.intellixity.insight.query.FilterSpec;
import io.intellixity.insight.query.Granularity;
import io.intellixity.insight.query.MetricSpec;
import io.intellixity.insight.query.TimeseriesRequest;
import io.intellixity.insight.util.AnalyticsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

import static io.intellixity.insight.clickhouse.fields.TableId.TRACE_SUMMARIES;

/**
 * Builds the complete timeseries query for a request, choosing one of the {@link QueryShape}s:
 * <ul>
 *   <li>full granularity with a multi-level metric: {@link QueryShape#SUBQUERY}, per period or keyed by group</li>
 *   <li>group key exploded from an array or living on a child table: {@link QueryShape#DEDUPLICATED_GROUPING}</li>
 *   <li>full granularity, no grouping: {@link QueryShape#SUMMARY}</li>
 *   <li>anything else: {@link QueryShape#BUCKETED}</li>
 * </ul>
 * Span and evaluation metrics are aggregated in one CTE per child table and joined back on
 * {@code period[, date][, group_key]}, so no SELECT aggregates primary columns over joined child rows.
 * Multi-level metrics need full granularity and are dropped elsewhere.
 * Filter options, top documents and feedback listings are built by {@link AuxiliaryQueries}.
 */
public final class AggregationBuilder {
  private static final Logger log = LoggerFactory.getLogger(AggregationBuilder.class);

  static final String DEDUP_CTE = "deduped";
  static final String SIMPLE_CTE = "simple_metrics";
  static final String TRACE_CTE = "trace_metrics";
  static final String PRIMARY_FROM = TRACE_SUMMARIES.tableName() + " " + TRACE_SUMMARIES.alias() + " FINAL";

  /** Result of compiling one request. */
  public record Compiled(QueryShape shape, BuiltQuery query, List<String> droppedSeries) {
    public Compiled {
      droppedSeries = List.copyOf(droppedSeries);
    }
  }

  private enum Period {
    CURRENT("current", "currentStart", "currentEnd"),
    PREVIOUS("previous", "previousStart", "previousEnd");

    final String label;
    final String start;
    final String end;

    Period(String label, String start, String end) {
      this.label = label;
      this.start = start;
      this.end = end;
    }

    String range() {
      String c = PrimaryColumn.CREATED_AT.raw();
      return c + " >= {" + start + ":DateTime64(3)} AND " + c + " < {" + end + ":DateTime64(3)}";
    }
  }

  /** Columns every part of one bucketed or grouped query is keyed on. */
  private record Keys(boolean dated, boolean grouped) {
    List<String> columns() {
      List<String> out = new ArrayList<>(3);
      out.add("period");
      if (dated) out.add("date");
      if (grouped) out.add("group_key");
      return out;
    }

    String using() { return "USING (" + String.join(", ", columns()) + ")"; }
  }

  private final FieldMap fields;
  private final FilterTranslator filters;
  private final MetricTranslator metrics;
  private final AnalyticsSettings settings;
  private final AuxiliaryQueries auxiliary;

  public AggregationBuilder() {
    this(FieldMap.standard(), AnalyticsSettings.load());
  }

  public AggregationBuilder(FieldMap fields, AnalyticsSettings settings) {
    this.fields = Objects.requireNonNull(fields, "fields");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.filters = new FilterTranslator(fields);
    this.metrics = new MetricTranslator(fields);
    this.auxiliary = new AuxiliaryQueries(fields, filters, settings);
  }

  public AnalyticsSettings settings() { return settings; }

  public BuiltQuery buildTimeseries(TimeseriesRequest request) {
    return compile(request).query();
  }

  /** {@code field}, {@code label}, {@code count} rows for one filter dropdown. */
  public BuiltQuery buildFilterOptions(FilterOptionsRequest request) {
    return auxiliary.filterOptions(request);
  }

  public TopDocumentsQuery buildTopDocuments(String tenantId, Instant start, Instant end, FilterSpec filter) {
    return auxiliary.topDocuments(tenantId, start, end, filter);
  }

  public BuiltQuery buildFeedbackEvents(String tenantId, Instant start, Instant end, FilterSpec filter) {
    return auxiliary.feedbackEvents(tenantId, start, end, filter);
  }

  public Compiled compile(TimeseriesRequest r) {
    ParamNames names = new ParamNames();
    Granularity granularity = TimeBuckets.adjust(r.granularity(), r.currentStart(), r.currentEnd(), settings.maxBuckets());
    String zone = TimeBuckets.resolveZone(r.timeZone(), settings.defaultTimeZone());

    Map<String, Object> params = new LinkedHashMap<>();
    params.put("tenantId", r.tenantId());
    params.put(Period.CURRENT.start, r.currentStart());
    params.put(Period.CURRENT.end, r.currentEnd());
    params.put(Period.PREVIOUS.start, r.previousStart());
    params.put(Period.PREVIOUS.end, r.previousEnd());

    FilterTranslation filter = filters.translateAll(r.filters(), names);
    params.putAll(filter.params());

    List<String> dropped = new ArrayList<>();
    QueryShape shape;
    String sql;

    if (r.hasGroupBy()) {
      GroupField group = GroupField.resolve(r.groupBy());
      if (!GroupField.isKnown(r.groupBy())) log.debug("Unknown group-by field '{}', grouping per trace", r.groupBy());
      String evaluatorScope = null;
      if (group.scopedByEvaluator() && r.groupByKey() != null) {
        ParamNames.Placeholder p = names.placeholder("groupByKey", "String");
        params.put(p.name(), r.groupByKey());
        evaluatorScope = fields.qualifiedColumn("evaluations.evaluator_id") + " = " + p.sql();
      }

      List<MetricTranslation> ms = translate(r.series(), names, group.needsDedup() ? ColumnScope.DEDUPED : ColumnScope.RAW);
      if (!granularity.isFull()) ms = withoutSubqueries(ms, dropped);
      if (ms.stream().anyMatch(MetricTranslation::requiresSubquery)) shape = QueryShape.SUBQUERY;
      else shape = group.needsDedup() ? QueryShape.DEDUPLICATED_GROUPING : QueryShape.BUCKETED;
      sql = group.needsDedup()
          ? deduplicated(group, evaluatorScope, ms, filter, granularity, zone)
          : bucketed(group, ms, filter, granularity, zone);
      for (MetricTranslation m : ms) params.putAll(m.params());
    } else if (granularity.isFull()) {
      List<MetricTranslation> ms = translate(r.series(), names, ColumnScope.RAW);
      shape = ms.stream().anyMatch(MetricTranslation::requiresSubquery) ? QueryShape.SUBQUERY : QueryShape.SUMMARY;
      sql = perPeriod(ms, filter);
      for (MetricTranslation m : ms) params.putAll(m.params());
    } else {
      shape = QueryShape.BUCKETED;
      List<MetricTranslation> ms = withoutSubqueries(translate(r.series(), names, ColumnScope.RAW), dropped);
      sql = bucketed(null, ms, filter, granularity, zone);
      for (MetricTranslation m : ms) params.putAll(m.params());
    }

    BuiltQuery q = new BuiltQuery(sql, params).requireResolved();
    if (log.isDebugEnabled()) log.debug("Timeseries query ({}): {}", shape, sql);
    return new Compiled(shape, q, dropped);
  }

  // ---- shapes ----

  private String bucketed(GroupField group, List<MetricTranslation> ms, FilterTranslation filter,
                          Granularity granularity, String zone) {
    Keys keys = new Keys(!granularity.isFull(), group != null);
    Map<TableId, List<MetricTranslation>> sources = bySource(ms);

    SelectBuilder traces = rows(group, granularity, zone, filter);
    for (MetricTranslation m : sources.getOrDefault(TRACE_SUMMARIES, List.of())) traces.select(m.selectItem());
    groupByKeys(traces, keys);
    if (group != null && group.kind() == GroupField.Kind.ARRAY) traces.having("group_key != ''");
    if (tracesOnly(ms)) return ordered(traces, keys).toSql();

    SelectBuilder out = new SelectBuilder().with(TRACE_CTE, traces.toSql());
    for (Map.Entry<TableId, List<MetricTranslation>> e : sources.entrySet()) {
      if (e.getKey().isPrimary()) continue;
      SelectBuilder child = rows(group, granularity, zone, filter).join(fields.innerJoinClause(e.getKey()));
      for (MetricTranslation m : e.getValue()) child.select(m.selectItem());
      out.with(metricsCte(e.getKey()), groupByKeys(child, keys).toSql());
    }
    for (MetricTranslation m : ms) {
      if (m.requiresSubquery()) out.with(nestedCte(m), keyedMetric(m, () -> rows(group, granularity, zone, filter)));
    }
    return joined(out, keys, ms);
  }

  private String deduplicated(GroupField group, String evaluatorScope, List<MetricTranslation> ms,
                              FilterTranslation filter, Granularity granularity, String zone) {
    Keys keys = new Keys(!granularity.isFull(), true);
    SelectBuilder cte = new SelectBuilder().distinct()
        .select(PrimaryColumn.TRACE_ID.carriedSelectItem())
        .select(group.keyExpression() + " AS group_key")
        .select(periodCase() + " AS period");
    if (keys.dated()) cte.select(TimeBuckets.truncate(PrimaryColumn.CREATED_AT.raw(), granularity.minutes(), zone) + " AS date");
    for (PrimaryColumn c : PrimaryColumn.values()) {
      if (c != PrimaryColumn.TRACE_ID) cte.select(c.carriedSelectItem());
    }
    cte.from(PRIMARY_FROM)
        .join(group.requiresChildRow() ? fields.innerJoinClause(group.table()) : fields.joinClause(group.table()))
        .where(bothPeriods())
        .where(filter.whereClause())
        .where(evaluatorScope);

    Map<TableId, List<MetricTranslation>> sources = bySource(ms);
    SelectBuilder traces = new SelectBuilder().select(keys.columns());
    for (MetricTranslation m : sources.getOrDefault(TRACE_SUMMARIES, List.of())) traces.select(m.selectItem());
    groupByKeys(traces.from(DEDUP_CTE), keys);
    if (group.kind() == GroupField.Kind.ARRAY) traces.having("group_key != ''");
    if (tracesOnly(ms)) return ordered(traces.with(DEDUP_CTE, cte.toSql()), keys).toSql();

    SelectBuilder out = new SelectBuilder().with(DEDUP_CTE, cte.toSql()).with(TRACE_CTE, traces.toSql());
    for (Map.Entry<TableId, List<MetricTranslation>> e : sources.entrySet()) {
      TableId t = e.getKey();
      if (t.isPrimary()) continue;
      SelectBuilder child;
      if (t == group.table()) {
        // each child row counts under its own key
        child = rows(group, granularity, zone, filter).join(fields.innerJoinClause(t)).where(evaluatorScope);
      } else {
        child = new SelectBuilder();
        for (String k : keys.columns()) child.select(DEDUP_CTE + "." + k + " AS " + k);
        child.from(DEDUP_CTE)
            .join("INNER JOIN " + t.tableName() + " " + t.alias() + " ON " + t.alias() + ".TraceId = " + DEDUP_CTE + ".trace_id")
            .where(t.alias() + ".TenantId = {tenantId:String}");
      }
      for (MetricTranslation m : e.getValue()) child.select(m.selectItem());
      out.with(metricsCte(t), groupByKeys(child, keys).toSql());
    }
    for (MetricTranslation m : ms) {
      if (m.requiresSubquery()) out.with(nestedCte(m), keyedMetric(m, AggregationBuilder::dedupedTraces));
    }
    return joined(out, keys, ms);
  }

  /** One scalar row per period, each metric read from its CTE and defaulted to 0. */
  private String perPeriod(List<MetricTranslation> ms, FilterTranslation filter) {
    Map<TableId, List<MetricTranslation>> sources = bySource(ms);
    SelectBuilder outer = new SelectBuilder();
    List<SelectBuilder> rows = new ArrayList<>();
    for (Period p : Period.values()) {
      SelectBuilder row = new SelectBuilder().select("'" + p.label + "' AS period");
      for (Map.Entry<TableId, List<MetricTranslation>> e : sources.entrySet()) {
        SelectBuilder s = periodBase(p, filter).join(fields.innerJoinClause(e.getKey()));
        for (MetricTranslation m : e.getValue()) s.select(m.selectItem());
        outer.with(periodCte(e.getKey(), p), s.toSql());
      }
      for (MetricTranslation m : ms) {
        if (!m.requiresSubquery()) continue;
        outer.with(nestedCte(m) + "_" + p.label, new SelectBuilder()
            .select(m.subquery().outerAggregation() + " AS " + m.quotedAlias())
            .fromSubquery(level(m.subquery(), m, p, filter))
            .toSql());
      }
      for (MetricTranslation m : ms) {
        String cte = m.requiresSubquery() ? nestedCte(m) + "_" + p.label : periodCte(m.source(), p);
        row.select("coalesce((SELECT " + m.quotedAlias() + " FROM " + cte + "), 0) AS " + m.quotedAlias());
      }
      rows.add(row);
    }
    return outer.select("*").fromSubquery(SelectBuilder.unionAll(rows)).orderBy("period").toSql();
  }

  /** Inner levels of a multi-level metric; the innermost one reads the filtered base tables. */
  private String level(SubqueryDescriptor d, MetricTranslation m, Period p, FilterTranslation filter) {
    if (d.nested() != null) {
      return new SelectBuilder().select(d.innerSelect())
          .fromSubquery(level(d.nested(), m, p, filter))
          .groupBy(d.innerGroupBy())
          .toSql();
    }
    SelectBuilder base = periodBase(p, filter).select(d.innerSelect());
    for (TableId t : m.requiredJoins()) base.join(fields.innerJoinClause(t));
    return base.groupBy(d.innerGroupBy()).toSql();
  }

  /** {@code (period, group_key, value)} rows of one multi-level metric. */
  private String keyedMetric(MetricTranslation m, Supplier<SelectBuilder> rows) {
    return new SelectBuilder()
        .select("period")
        .select("group_key")
        .select(m.subquery().outerAggregation() + " AS " + m.quotedAlias())
        .fromSubquery(keyedLevel(m.subquery(), m, rows))
        .groupBy("period")
        .groupBy("group_key")
        .toSql();
  }

  /** {@link #level} with {@code period} and {@code group_key} carried through every level. */
  private String keyedLevel(SubqueryDescriptor d, MetricTranslation m, Supplier<SelectBuilder> rows) {
    SelectBuilder b;
    if (d.nested() != null) {
      b = new SelectBuilder().select("period").select("group_key").select(d.innerSelect())
          .fromSubquery(keyedLevel(d.nested(), m, rows));
    } else {
      b = rows.get().select(d.innerSelect());
      for (TableId t : m.requiredJoins()) b.join(fields.innerJoinClause(t));
    }
    return b.groupBy("period").groupBy("group_key").groupBy(d.innerGroupBy()).toSql();
  }

  private SelectBuilder periodBase(Period p, FilterTranslation filter) {
    return new SelectBuilder()
        .from(PRIMARY_FROM)
        .where(tenant())
        .where(p.range())
        .where(filter.whereClause());
  }

  /** Filtered primary rows of both periods with the key columns selected. */
  private static SelectBuilder rows(GroupField group, Granularity granularity, String zone, FilterTranslation filter) {
    SelectBuilder b = new SelectBuilder().select(periodCase() + " AS period");
    if (!granularity.isFull()) b.select(TimeBuckets.truncate(PrimaryColumn.CREATED_AT.raw(), granularity.minutes(), zone) + " AS date");
    if (group != null) b.select(group.keyExpression() + " AS group_key");
    return b.from(PRIMARY_FROM).where(bothPeriods()).where(filter.whereClause());
  }

  /** Primary rows of the deduplicated traces, once per (period, group key) they belong to. */
  private static SelectBuilder dedupedTraces() {
    return new SelectBuilder()
        .select("g.period AS period")
        .select("g.group_key AS group_key")
        .from(PRIMARY_FROM)
        .join("INNER JOIN (SELECT DISTINCT trace_id, period, group_key FROM " + DEDUP_CTE + ") g ON g.trace_id = "
            + PrimaryColumn.TRACE_ID.raw())
        .where(bothPeriods());
  }

  /** Final SELECT over {@link #TRACE_CTE} with the child-table and multi-level CTEs LEFT JOINed on the keys. */
  private static String joined(SelectBuilder out, Keys keys, List<MetricTranslation> ms) {
    out.select(keys.columns());
    for (MetricTranslation m : ms) out.select(m.quotedAlias());
    out.from(TRACE_CTE);
    for (MetricTranslation m : ms) {
      if (m.requiresSubquery()) out.join("LEFT JOIN " + nestedCte(m) + " " + keys.using());
      else if (!m.source().isPrimary()) out.join("LEFT JOIN " + metricsCte(m.source()) + " " + keys.using());
    }
    return ordered(out, keys).toSql();
  }

  // ---- helpers ----

  private List<MetricTranslation> translate(List<MetricSpec> series, ParamNames names, ColumnScope scope) {
    List<MetricTranslation> out = new ArrayList<>(series.size());
    for (MetricSpec s : series) out.add(metrics.translate(s, names, scope));
    return out;
  }

  private static List<MetricTranslation> withoutSubqueries(List<MetricTranslation> ms, List<String> dropped) {
    List<MetricTranslation> out = new ArrayList<>(ms.size());
    for (MetricTranslation m : ms) {
      if (m.requiresSubquery()) {
        log.warn("Dropping series '{}': multi-level aggregation is not supported in bucketed queries, use full granularity", m.alias());
        dropped.add(m.alias());
      } else {
        out.add(m);
      }
    }
    return out;
  }

  /** Single-level metrics by the table they aggregate; primary table first. */
  private static Map<TableId, List<MetricTranslation>> bySource(List<MetricTranslation> ms) {
    Map<TableId, List<MetricTranslation>> out = new EnumMap<>(TableId.class);
    for (MetricTranslation m : ms) {
      if (!m.requiresSubquery()) out.computeIfAbsent(m.source(), t -> new ArrayList<>()).add(m);
    }
    return out;
  }

  private static boolean tracesOnly(List<MetricTranslation> ms) {
    for (MetricTranslation m : ms) {
      if (m.requiresSubquery() || !m.source().isPrimary()) return false;
    }
    return true;
  }

  private static SelectBuilder groupByKeys(SelectBuilder b, Keys keys) {
    for (String k : keys.columns()) b.groupBy(k);
    return b;
  }

  private static SelectBuilder ordered(SelectBuilder b, Keys keys) {
    b.orderBy("period");
    if (keys.dated()) b.orderBy("date");
    return b;
  }

  /** {@code stored_spans_metrics}, {@code evaluation_runs_metrics} */
  static String metricsCte(TableId t) { return t.tableName() + "_metrics"; }

  private static String periodCte(TableId t, Period p) {
    return (t.isPrimary() ? SIMPLE_CTE : metricsCte(t)) + "_" + p.label;
  }

  private static String nestedCte(MetricTranslation m) { return "cte_" + m.alias(); }

  private static String periodCase() {
    return "CASE\n"
        + "    WHEN " + Period.CURRENT.range() + " THEN '" + Period.CURRENT.label + "'\n"
        + "    WHEN " + Period.PREVIOUS.range() + " THEN '" + Period.PREVIOUS.label + "'\n"
        + "  END";
  }

  static String tenant() {
    return TRACE_SUMMARIES.alias() + ".TenantId = {tenantId:String}";
  }

  private static String bothPeriods() {
    return tenant() + "\n  AND ((" + Period.CURRENT.range() + ") OR (" + Period.PREVIOUS.range() + "))";
  }
}
