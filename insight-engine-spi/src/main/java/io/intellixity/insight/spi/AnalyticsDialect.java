package io.intellixity.insight.spi;

import io.intellixity.insight.compile.BuiltQuery;
import io.intellixity.insight.compile.TopDocumentsQuery;
import io.intellixity.insight.query.FilterOptionsRequest;
import io.intellixity.insight.query.FilterSpec;
import io.intellixity.insight.query.TimeseriesRequest;

import java.time.Instant;

/** Backend-agnostic SPI: compiles analytics requests into parameterized native queries. Never executes them. */
public interface AnalyticsDialect {
  String id();

  BuiltQuery buildTimeseries(TimeseriesRequest request);

  /** Distinct values of one filter field with their trace counts. */
  BuiltQuery buildFilterOptions(FilterOptionsRequest request);

  TopDocumentsQuery buildTopDocuments(String tenantId, Instant start, Instant end, FilterSpec filters);

  /** Latest feedback events (thumbs up/down with a comment). */
  BuiltQuery buildFeedbackEvents(String tenantId, Instant start, Instant end, FilterSpec filters);
}
