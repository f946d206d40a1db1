package io.intellixity.insight.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One analytics request: metrics over a current period compared against the previous one.
 * The previous period ends where the current one starts.
 */
@JsonDeserialize(using = TimeseriesRequestJsonDeserializer.class)
public record TimeseriesRequest(
    String tenantId,
    Instant currentStart,
    Instant currentEnd,
    Instant previousStart,
    List<MetricSpec> series,
    FilterSpec filters,
    String groupBy,
    String groupByKey,
    Granularity granularity,
    String timeZone
) {
  public TimeseriesRequest {
    if (tenantId == null || tenantId.isBlank()) throw new QueryValidationException("tenantId is required");
    Objects.requireNonNull(currentStart, "currentStart");
    Objects.requireNonNull(currentEnd, "currentEnd");
    Objects.requireNonNull(previousStart, "previousStart");
    if (!currentStart.isBefore(currentEnd)) {
      throw new QueryValidationException("currentStart must be before currentEnd");
    }
    if (previousStart.isAfter(currentStart)) {
      throw new QueryValidationException("previousStart must not be after currentStart");
    }
    series = series == null ? List.of() : List.copyOf(series);
    filters = filters == null ? FilterSpec.empty() : filters;
    groupBy = (groupBy == null || groupBy.isBlank()) ? null : groupBy;
    groupByKey = (groupByKey == null || groupByKey.isBlank()) ? null : groupByKey;
    granularity = granularity == null ? Granularity.full() : granularity;
    timeZone = (timeZone == null || timeZone.isBlank()) ? null : timeZone;
  }

  public Instant previousEnd() { return currentStart; }

  public boolean hasGroupBy() { return groupBy != null; }

  public static Builder builder(String tenantId) { return new Builder(tenantId); }

  public static final class Builder {
    private final String tenantId;
    private Instant currentStart;
    private Instant currentEnd;
    private Instant previousStart;
    private List<MetricSpec> series = List.of();
    private FilterSpec filters;
    private String groupBy;
    private String groupByKey;
    private Granularity granularity;
    private String timeZone;

    private Builder(String tenantId) {
      this.tenantId = tenantId;
    }

    /** Current period is [start, end); previous period is [previousStart, start). */
    public Builder period(Instant start, Instant end, Instant previousStart) {
      this.currentStart = start;
      this.currentEnd = end;
      this.previousStart = previousStart;
      return this;
    }

    public Builder series(List<MetricSpec> series) { this.series = series; return this; }
    public Builder series(MetricSpec... series) { this.series = List.of(series); return this; }
    public Builder filters(FilterSpec filters) { this.filters = filters; return this; }
    public Builder groupBy(String groupBy) { this.groupBy = groupBy; return this; }
    public Builder groupByKey(String groupByKey) { this.groupByKey = groupByKey; return this; }
    public Builder granularity(Granularity granularity) { this.granularity = granularity; return this; }
    public Builder timeZone(String timeZone) { this.timeZone = timeZone; return this; }

    public TimeseriesRequest build() {
      return new TimeseriesRequest(tenantId, currentStart, currentEnd, previousStart, series, filters,
          groupBy, groupByKey, granularity, timeZone);
    }
  }
}
