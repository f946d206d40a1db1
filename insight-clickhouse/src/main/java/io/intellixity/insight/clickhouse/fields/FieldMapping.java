package io.intellixity.insight.clickhouse.fields;

import java.util.Objects;

/**
 * Physical location of a logical field. {@code columnExpr} is unqualified
 * (e.g. {@code Attributes['langwatch.user_id']}); see {@link FieldMap#qualifiedColumn(String)}.
 */
public record FieldMapping(
    String logicalPath,
    TableId table,
    String columnExpr,
    boolean arrayValued,
    boolean mapValued,
    MapValueKind valueKind
) {
  public FieldMapping {
    Objects.requireNonNull(logicalPath, "logicalPath");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(columnExpr, "columnExpr");
    valueKind = valueKind == null ? MapValueKind.STRING : valueKind;
  }
}
