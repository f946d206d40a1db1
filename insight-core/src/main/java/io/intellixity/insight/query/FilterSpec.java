package io.intellixity.insight.query;

import java.util.*;

/**
 * Ordered set of filters for one request.
 * <p>
 * Accepts the legacy nested shape, where each field maps to one of:
 * <ul>
 *   <li>a list of values</li>
 *   <li>a map of key to list of values</li>
 *   <li>a map of key to (map of subkey to list of values)</li>
 * </ul>
 * Empty value lists are kept as entries but translate to no-ops.
 */
public final class FilterSpec {
  private static final FilterSpec EMPTY = new FilterSpec(List.of());

  private final List<FilterEntry> entries;

  private FilterSpec(List<FilterEntry> entries) {
    this.entries = List.copyOf(entries);
  }

  public static FilterSpec empty() { return EMPTY; }

  public static Builder builder() { return new Builder(); }

  public List<FilterEntry> entries() { return entries; }

  public boolean isEmpty() {
    for (FilterEntry e : entries) {
      if (!e.isEmpty()) return false;
    }
    return true;
  }

  /** Parse the legacy nested map shape (as decoded from JSON). */
  public static FilterSpec fromNested(Map<String, ?> nested) {
    if (nested == null || nested.isEmpty()) return EMPTY;
    Builder b = builder();
    for (var e : nested.entrySet()) {
      String field = e.getKey();
      Object v = e.getValue();
      if (field == null || v == null) continue;

      if (v instanceof Collection<?> c) {
        b.values(field, toStrings(c, field));
        continue;
      }
      if (!(v instanceof Map<?, ?> byKey)) {
        throw new QueryValidationException("Filter '" + field + "' must be a list or an object, got " + v.getClass().getSimpleName());
      }
      for (var ke : byKey.entrySet()) {
        String key = String.valueOf(ke.getKey());
        Object kv = ke.getValue();
        if (kv == null) continue;
        if (kv instanceof Collection<?> c) {
          b.keyed(field, key, toStrings(c, field));
          continue;
        }
        if (!(kv instanceof Map<?, ?> bySubkey)) {
          throw new QueryValidationException("Filter '" + field + "." + key + "' must be a list or an object");
        }
        for (var se : bySubkey.entrySet()) {
          Object sv = se.getValue();
          if (sv == null) continue;
          if (!(sv instanceof Collection<?> c)) {
            throw new QueryValidationException("Filter '" + field + "." + key + "." + se.getKey() + "' must be a list");
          }
          b.subkeyed(field, key, String.valueOf(se.getKey()), toStrings(c, field));
        }
      }
    }
    return b.build();
  }

  private static List<String> toStrings(Collection<?> c, String field) {
    List<String> out = new ArrayList<>(c.size());
    for (Object x : c) {
      if (x == null) continue;
      if (x instanceof Map<?, ?> || x instanceof Collection<?>) {
        throw new QueryValidationException("Filter '" + field + "' values must be scalars");
      }
      out.add(String.valueOf(x));
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FilterSpec f && entries.equals(f.entries);
  }

  @Override
  public int hashCode() { return entries.hashCode(); }

  @Override
  public String toString() { return "FilterSpec" + entries; }

  public static final class Builder {
    private final List<FilterEntry> entries = new ArrayList<>();

    private Builder() {}

    public Builder values(String field, List<String> values) {
      entries.add(new FilterEntry(field, values, null, null));
      return this;
    }

    public Builder keyed(String field, String key, List<String> values) {
      entries.add(new FilterEntry(field, values, key, null));
      return this;
    }

    public Builder subkeyed(String field, String key, String subkey, List<String> values) {
      entries.add(new FilterEntry(field, values, key, subkey));
      return this;
    }

    public FilterSpec build() {
      return entries.isEmpty() ? EMPTY : new FilterSpec(entries);
    }
  }
}
