package io.intellixity.insight.clickhouse.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured SELECT assembly: clauses are collected as values and rendered once by {@link #toSql()}.
 * Fragments are trusted SQL text (columns from the field map, placeholders); never caller values.
 */
public final class SelectBuilder {
  private final Map<String, String> with = new LinkedHashMap<>();
  private final List<String> select = new ArrayList<>();
  private boolean distinct;
  private String from;
  private final List<String> joins = new ArrayList<>();
  private final List<String> where = new ArrayList<>();
  private final List<String> groupBy = new ArrayList<>();
  private final List<String> having = new ArrayList<>();
  private final List<String> orderBy = new ArrayList<>();
  private Integer limit;

  public SelectBuilder with(String name, String body) { with.put(name, body); return this; }
  public SelectBuilder distinct() { distinct = true; return this; }
  public SelectBuilder select(String item) { select.add(item); return this; }
  public SelectBuilder select(List<String> items) { select.addAll(items); return this; }
  public SelectBuilder from(String source) { from = source; return this; }
  public SelectBuilder fromSubquery(String sql) { from = "(" + indent(sql) + "\n)"; return this; }
  public SelectBuilder join(String clause) { if (!clause.isEmpty() && !joins.contains(clause)) joins.add(clause); return this; }

  /** AND-ed predicate; "1=1" is skipped. */
  public SelectBuilder where(String predicate) {
    if (predicate != null && !predicate.isBlank() && !"1=1".equals(predicate)) where.add(predicate);
    return this;
  }

  public SelectBuilder groupBy(String expr) { groupBy.add(expr); return this; }
  public SelectBuilder having(String predicate) { having.add(predicate); return this; }
  public SelectBuilder orderBy(String expr) { orderBy.add(expr); return this; }
  public SelectBuilder limit(int limit) { this.limit = limit; return this; }

  public boolean hasSelect() { return !select.isEmpty(); }

  public String toSql() {
    if (select.isEmpty()) throw new IllegalStateException("SELECT list is empty");
    StringBuilder sb = new StringBuilder(256);
    if (!with.isEmpty()) {
      sb.append("WITH ");
      boolean first = true;
      for (var e : with.entrySet()) {
        if (!first) sb.append(",\n");
        sb.append(e.getKey()).append(" AS (\n").append(indent(e.getValue())).append("\n)");
        first = false;
      }
      sb.append('\n');
    }
    sb.append(distinct ? "SELECT DISTINCT\n  " : "SELECT\n  ").append(String.join(",\n  ", select));
    if (from != null) sb.append("\nFROM ").append(from);
    for (String j : joins) sb.append('\n').append(j);
    if (!where.isEmpty()) sb.append("\nWHERE ").append(String.join("\n  AND ", where));
    if (!groupBy.isEmpty()) sb.append("\nGROUP BY ").append(String.join(", ", groupBy));
    if (!having.isEmpty()) sb.append("\nHAVING ").append(String.join(" AND ", having));
    if (!orderBy.isEmpty()) sb.append("\nORDER BY ").append(String.join(", ", orderBy));
    if (limit != null) sb.append("\nLIMIT ").append(limit);
    return sb.toString();
  }

  /** {@code a UNION ALL b ...}, each part rendered on its own. */
  public static String unionAll(List<SelectBuilder> parts) {
    List<String> out = new ArrayList<>(parts.size());
    for (SelectBuilder p : parts) out.add(p.toSql());
    return String.join("\nUNION ALL\n", out);
  }

  private static String indent(String sql) {
    return "  " + sql.replace("\n", "\n  ");
  }
}
