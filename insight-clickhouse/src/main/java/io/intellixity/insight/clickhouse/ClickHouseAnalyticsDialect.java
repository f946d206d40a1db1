package io.intellixity.insight.clickhouse;

import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.compile.BuiltQuery;
import io.intellixity.insight.compile.TopDocumentsQuery;
import io.intellixity.insight.query.FilterOptionsRequest;
import io.intellixity.insight.query.FilterSpec;
import io.intellixity.insight.query.TimeseriesRequest;
import io.intellixity.insight.spi.AnalyticsDialect;
import io.intellixity.insight.util.AnalyticsSettings;

import java.time.Instant;

/** ClickHouse analytics dialect (id {@code clickhouse}), discovered via META-INF/insight.factories. */
public final class ClickHouseAnalyticsDialect implements AnalyticsDialect {
  public static final String ID = "clickhouse";

  private final AggregationBuilder builder;

  public ClickHouseAnalyticsDialect() {
    this(new AggregationBuilder(FieldMap.standard(), AnalyticsSettings.load()));
  }

  public ClickHouseAnalyticsDialect(AggregationBuilder builder) {
    this.builder = builder;
  }

  @Override public String id() { return ID; }

  @Override
  public BuiltQuery buildTimeseries(TimeseriesRequest request) {
    return builder.buildTimeseries(request);
  }

  @Override
  public BuiltQuery buildFilterOptions(FilterOptionsRequest request) {
    return builder.buildFilterOptions(request);
  }

  @Override
  public TopDocumentsQuery buildTopDocuments(String tenantId, Instant start, Instant end, FilterSpec filters) {
    return builder.buildTopDocuments(tenantId, start, end, filters);
  }

  @Override
  public BuiltQuery buildFeedbackEvents(String tenantId, Instant start, Instant end, FilterSpec filters) {
    return builder.buildFeedbackEvents(tenantId, start, end, filters);
  }

  public AggregationBuilder builder() { return builder; }
}
