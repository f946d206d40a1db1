package io.intellixity.insight.compile;

import java.util.*;

/** Terminal artifact: SQL with {@code {name:Type}} placeholders plus the values to bind for them. */
public record BuiltQuery(String sql, Map<String, Object> params) {
  public BuiltQuery {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  /** Placeholder names referenced by {@link #sql()} that have no entry in {@link #params()}. */
  public Set<String> unresolvedPlaceholders() {
    Set<String> out = new LinkedHashSet<>();
    for (ParamPlaceholders.Placeholder p : ParamPlaceholders.scan(sql)) {
      if (!params.containsKey(p.name())) out.add(p.name());
    }
    return out;
  }

  public BuiltQuery requireResolved() {
    Set<String> missing = unresolvedPlaceholders();
    if (!missing.isEmpty()) throw new IllegalStateException("Missing query param: " + String.join(", ", missing));
    return this;
  }
}
