package io.intellixity.insight.query;

import java.util.List;
import java.util.Objects;

/** A single filter: field + accepted values, optionally scoped by key and subkey. */
public record FilterEntry(String field, List<String> values, String key, String subkey) {
  public FilterEntry {
    Objects.requireNonNull(field, "field");
    values = values == null ? List.of() : List.copyOf(values);
    key = (key == null || key.isEmpty()) ? null : key;
    subkey = (subkey == null || subkey.isEmpty()) ? null : subkey;
  }

  public boolean isEmpty() { return values.isEmpty(); }
}
