package io.intellixity.insight.spi;

import io.intellixity.insight.util.InsightFactoriesLoader;

import java.util.*;

/**
 * Dialect registry built via discovery (META-INF/insight.factories).
 * The first dialect discovered for an id wins.
 */
public final class DiscoveredDialectRegistry {
  private final Map<String, AnalyticsDialect> byId;

  public DiscoveredDialectRegistry() {
    this(InsightFactoriesLoader.load(AnalyticsDialect.class));
  }

  DiscoveredDialectRegistry(List<AnalyticsDialect> dialects) {
    Map<String, AnalyticsDialect> m = new LinkedHashMap<>();
    for (AnalyticsDialect d : dialects) {
      if (d == null || d.id() == null || d.id().isBlank()) continue;
      m.putIfAbsent(d.id(), d);
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  public AnalyticsDialect get(String id) {
    AnalyticsDialect d = byId.get(id);
    if (d == null) throw new IllegalArgumentException("No analytics dialect registered for id: " + id + " (known: " + byId.keySet() + ")");
    return d;
  }

  public Optional<AnalyticsDialect> find(String id) { return Optional.ofNullable(byId.get(id)); }

  public Set<String> ids() { return byId.keySet(); }
}
