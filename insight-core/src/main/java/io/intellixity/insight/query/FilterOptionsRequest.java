package io.intellixity.insight.query;

import java.time.Instant;
import java.util.Objects;

/** Lists the values of one filter field (for dropdowns), optionally narrowed by a search string and other filters. */
public record FilterOptionsRequest(
    String tenantId,
    String field,
    String key,
    String subkey,
    Instant start,
    Instant end,
    String query,
    FilterSpec filters
) {
  public FilterOptionsRequest {
    if (tenantId == null || tenantId.isBlank()) throw new QueryValidationException("tenantId is required");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    key = (key == null || key.isEmpty()) ? null : key;
    subkey = (subkey == null || subkey.isEmpty()) ? null : subkey;
    query = (query == null || query.isBlank()) ? null : query;
    filters = filters == null ? FilterSpec.empty() : filters;
  }

  public static FilterOptionsRequest of(String tenantId, String field, Instant start, Instant end) {
    return new FilterOptionsRequest(tenantId, field, null, null, start, end, null, null);
  }

  public FilterOptionsRequest withQuery(String query) {
    return new FilterOptionsRequest(tenantId, field, key, subkey, start, end, query, filters);
  }

  public FilterOptionsRequest withKey(String key, String subkey) {
    return new FilterOptionsRequest(tenantId, field, key, subkey, start, end, query, filters);
  }

  public FilterOptionsRequest withFilters(FilterSpec filters) {
    return new FilterOptionsRequest(tenantId, field, key, subkey, start, end, query, filters);
  }
}
