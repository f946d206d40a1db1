package io.intellixity.insight.clickhouse.fields;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FieldMapTest {
  private final FieldMap fields = FieldMap.standard();

  @Test
  void qualifiesPlainAndMapColumns() {
    assertEquals("ts.TopicId", fields.qualifiedColumn("topics.topics"));
    assertEquals("ts.Attributes['langwatch.user_id']", fields.qualifiedColumn("metadata.user_id"));
    assertEquals("ss.SpanAttributes['gen_ai.request.model']", fields.qualifiedColumn("spans.model"));
    assertEquals("ss.\"Events.Name\"", fields.qualifiedColumn("events.event_type"));
    assertEquals("es.Score", fields.qualifiedColumn("evaluations.score"));
  }

  @Test
  void unknownPathFallsBackToSanitizedPrimaryColumn() {
    assertFalse(fields.isKnown("custom.someField"));
    FieldMapping m = fields.resolve("custom.someField");
    assertEquals(TableId.TRACE_SUMMARIES, m.table());
    assertEquals("some_field", m.columnExpr());
    assertEquals("trace_id", FieldMap.fallbackColumn(null));
    assertEquals("_9lives", FieldMap.fallbackColumn("x.9lives"));
    assertEquals("a_b", FieldMap.fallbackColumn("x.a-b"));
  }

  @Test
  void childJoinsCorrelateOnTenantAndTrace() {
    assertEquals("", fields.joinClause(TableId.TRACE_SUMMARIES));
    assertEquals("LEFT JOIN stored_spans ss ON ss.TenantId = ts.TenantId AND ss.TraceId = ts.TraceId",
        fields.joinClause(TableId.STORED_SPANS));
    assertTrue(fields.innerJoinClause(TableId.EVALUATION_RUNS).startsWith("INNER JOIN evaluation_runs es ON "));
  }

  @Test
  void mapValuedAndArrayValuedFlags() {
    assertTrue(fields.resolve("metadata.labels").mapValued());
    assertTrue(fields.resolve("metadata.labels").arrayValued());
    assertFalse(fields.resolve("metadata.user_id").arrayValued());
    assertTrue(fields.resolve("events.event_type").arrayValued());
  }

  @Test
  void primaryColumnsCarryIntoDedupScope() {
    assertEquals("ts.TotalCost", ColumnScope.RAW.column(PrimaryColumn.TOTAL_COST));
    assertEquals("total_cost", ColumnScope.DEDUPED.column(PrimaryColumn.TOTAL_COST));
    assertEquals("ts.Attributes['gen_ai.conversation.id'] AS thread_id", PrimaryColumn.THREAD_ID.carriedSelectItem());
  }
}
