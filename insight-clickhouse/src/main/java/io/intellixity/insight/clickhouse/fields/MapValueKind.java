package io.intellixity.insight.clickhouse.fields;

/** How the value behind a column (or map entry) is stored. */
public enum MapValueKind {
  STRING,
  NUMBER,
  /** A JSON array serialized into a string attribute, read with JSONExtract. */
  JSON_ARRAY
}
