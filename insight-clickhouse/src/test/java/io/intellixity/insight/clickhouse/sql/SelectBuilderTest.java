package io.intellixity.insight.clickhouse.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SelectBuilderTest {
  @Test
  void rendersClausesInOrderAndSkipsTrivialPredicates() {
    String sql = new SelectBuilder()
        .with("c", "SELECT 1 AS x")
        .select("x")
        .select("count() AS n")
        .from("c")
        .join("LEFT JOIN t ON 1")
        .join("LEFT JOIN t ON 1")
        .join("")
        .where("1=1")
        .where("x > 0")
        .where(null)
        .groupBy("x")
        .having("n > 1")
        .orderBy("x")
        .limit(5)
        .toSql();
    assertEquals("WITH c AS (\n  SELECT 1 AS x\n)\n"
        + "SELECT\n  x,\n  count() AS n\nFROM c\nLEFT JOIN t ON 1\nWHERE x > 0\nGROUP BY x\nHAVING n > 1\nORDER BY x\nLIMIT 5", sql);
  }

  @Test
  void unionAllAndEmptySelect() {
    String u = SelectBuilder.unionAll(List.of(new SelectBuilder().select("1"), new SelectBuilder().select("2")));
    assertEquals("SELECT\n  1\nUNION ALL\nSELECT\n  2", u);
    assertThrows(IllegalStateException.class, () -> new SelectBuilder().from("t").toSql());
  }

  @Test
  void paramNamesAreSequentialPerInstance() {
    ParamNames names = new ParamNames();
    assertEquals("a_0", names.next("a"));
    ParamNames.Placeholder p = names.placeholder("b", "String");
    assertEquals("b_1", p.name());
    assertEquals("{b_1:String}", p.sql());
    assertEquals("a_0", new ParamNames().next("a"));
  }
}
