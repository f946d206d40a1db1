package io.intellixity.insight.clickhouse.filter;

import io.intellixity.insight.clickhouse.fields.FieldMap;
import io.intellixity.insight.clickhouse.sql.ParamNames;
import io.intellixity.insight.query.FilterSpec;
import io.intellixity.insight.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FilterTranslatorTest {
  private final FilterTranslator translator = new FilterTranslator(FieldMap.standard());

  @Test
  void topicsBecomeBoundInList() {
    FilterSpec spec = FilterSpec.fromNested(Map.of("topics.topics", List.of("a", "b")));
    FilterTranslation t = translator.translateAll(spec, new ParamNames());

    assertEquals("(ts.TopicId IN ({topicIds_0:Array(String)}))", t.whereClause());
    assertEquals(Map.of("topicIds_0", List.of("a", "b")), t.params());
    assertTrue(t.requiredJoins().isEmpty());
    assertFalse(t.usesExistsSubquery());
  }

  @Test
  void emptyAndUnknownFiltersAreNoOps() {
    ParamNames names = new ParamNames();
    assertTrue(translator.translateAll(FilterSpec.empty(), names).isTrivial());
    assertTrue(translator.translateAll(null, names).isTrivial());
    assertTrue(translator.translate("topics.topics", List.of(), null, null, names).isTrivial());
    assertTrue(translator.translate("no.such.field", List.of("x"), null, null, names).isTrivial());
    assertTrue(translator.translate("metadata.value", List.of("x"), null, null, names).isTrivial());
    assertEquals(FilterTranslation.TRUE, translator.translateAll(FilterSpec.empty(), names).whereClause());
  }

  @Test
  void callerStringsNeverReachSqlText() {
    String evil = "x') OR 1=1 --";
    FilterSpec spec = FilterSpec.builder()
        .values("metadata.user_id", List.of(evil))
        .keyed("metadata.value", evil, List.of(evil))
        .values("spans.model", List.of(evil))
        .keyed("evaluations.label", evil, List.of(evil))
        .build();
    FilterTranslation t = translator.translateAll(spec, new ParamNames());

    assertFalse(t.whereClause().contains(evil));
    assertTrue(t.params().containsValue(List.of(evil)));
    assertTrue(t.params().containsValue(evil));
  }

  @Test
  void childTableFiltersUseExistsWithoutJoins() {
    FilterSpec spec = FilterSpec.builder()
        .values("spans.type", List.of("llm"))
        .values("evaluations.evaluator_id", List.of("ev1"))
        .values("events.event_type", List.of("thumbs_up_down"))
        .build();
    FilterTranslation t = translator.translateAll(spec, new ParamNames());

    assertTrue(t.usesExistsSubquery());
    assertTrue(t.requiredJoins().isEmpty());
    assertTrue(t.whereClause().contains("EXISTS (\n  SELECT 1 FROM stored_spans ss\n  WHERE ss.TenantId = ts.TenantId AND ss.TraceId = ts.TraceId"));
    assertTrue(t.whereClause().contains("SELECT 1 FROM evaluation_runs es"));
    assertFalse(t.whereClause().contains("JOIN"));
  }

  @Test
  void guardrailsOnlyAddsGuardrailCondition() {
    FilterTranslation t = translator.translate("evaluations.evaluator_id.guardrails_only", List.of("ev1"), null, null, new ParamNames());
    assertTrue(t.whereClause().contains("es.EvaluatorId IN ({evaluatorIds_0:Array(String)})"));
    assertTrue(t.whereClause().contains("es.IsGuardrail = 1"));
  }

  @Test
  void booleanFlagsCollapseWhenBothValuesRequested() {
    ParamNames names = new ParamNames();
    assertEquals("ts.ContainsErrorStatus = 1", translator.translate("traces.error", List.of("true"), null, null, names).whereClause());
    assertEquals("(ts.HasAnnotation = 0 OR ts.HasAnnotation IS NULL)",
        translator.translate("annotations.hasAnnotation", List.of("false"), null, null, names).whereClause());
    assertTrue(translator.translate("traces.error", List.of("true", "false"), null, null, names).isTrivial());
    assertTrue(translator.translate("evaluations.passed", List.of("true", "false"), "ev1", null, names).isTrivial());
  }

  @Test
  void evaluationPassedScopedToEvaluator() {
    FilterTranslation t = translator.translate("evaluations.passed", List.of("true"), "ev1", null, new ParamNames());
    assertTrue(t.whereClause().contains("es.EvaluatorId = {evaluatorId_0:String}"));
    assertTrue(t.whereClause().contains("es.Passed IN ({evalPassed_1:Array(UInt8)})"));
    assertEquals("ev1", t.params().get("evaluatorId_0"));
    assertEquals(List.of(1), t.params().get("evalPassed_1"));
  }

  @Test
  void scoreRangeIsBoundAsNumbers() {
    FilterTranslation t = translator.translate("evaluations.score", List.of("0.5", "1"), null, null, new ParamNames());
    assertTrue(t.whereClause().contains("es.Score >= {scoreMin_0:Float64}"));
    assertTrue(t.whereClause().contains("es.Score <= {scoreMax_1:Float64}"));
    assertEquals(0.5, t.params().get("scoreMin_0"));
    assertEquals(1.0, t.params().get("scoreMax_1"));
  }

  @Test
  void malformedRangesAreRejected() {
    assertThrows(QueryValidationException.class, () -> FilterTranslator.range("evaluations.score", List.of("abc", "1")));
    assertThrows(QueryValidationException.class, () -> FilterTranslator.range("evaluations.score", List.of("1")));
    assertThrows(QueryValidationException.class, () -> FilterTranslator.range("evaluations.score", List.of("NaN", "1")));
    assertThrows(QueryValidationException.class, () -> FilterTranslator.range("evaluations.score", List.of("2", "1")));
    assertArrayEquals(new double[] {-1.0, 3.5}, FilterTranslator.range("evaluations.score", List.of(" -1 ", "3.5")));
  }

  @Test
  void eventMetricValueNeedsMetricKey() {
    ParamNames names = new ParamNames();
    assertTrue(translator.translate("events.metrics.value", List.of("0", "1"), "thumbs", null, names).isTrivial());
    FilterTranslation t = translator.translate("events.metrics.value", List.of("0", "1"), "thumbs", "vote", names);
    assertTrue(t.whereClause().contains("arrayExists((name, attrs) -> name = {eventType_"));
    assertEquals("vote", t.params().get("metricKey_0"));
    assertEquals("thumbs", t.params().get("eventType_3"));
  }

  @Test
  void metadataKeysRestoreDots() {
    FilterTranslation t = translator.translate("metadata.key", List.of("app\u00B7version"), null, null, new ParamNames());
    assertEquals(List.of("app.version"), t.params().get("metaKeys_0"));
  }

  @Test
  void combineParenthesizesAndMergesParams() {
    ParamNames names = new ParamNames();
    FilterTranslation a = translator.translate("topics.topics", List.of("a"), null, null, names);
    FilterTranslation b = translator.translate("traces.error", List.of("true"), null, null, names);
    FilterTranslation c = FilterTranslator.combine(List.of(a, FilterTranslation.TRIVIAL, b));
    assertEquals("(ts.TopicId IN ({topicIds_0:Array(String)})) AND (ts.ContainsErrorStatus = 1)", c.whereClause());
    assertEquals(1, c.params().size());
  }
}
