package io.intellixity.insight.query;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FilterSpecTest {
  @Test
  void flattensAllThreeNestingLevelsInOrder() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("metadata.user_id", List.of("u1"));
    nested.put("metadata.value", Map.of("env", List.of("prod")));
    nested.put("events.metrics.value", Map.of("thumbs", Map.of("vote", List.of(1, 5))));

    FilterSpec f = FilterSpec.fromNested(nested);

    assertEquals(List.of(
        new FilterEntry("metadata.user_id", List.of("u1"), null, null),
        new FilterEntry("metadata.value", List.of("prod"), "env", null),
        new FilterEntry("events.metrics.value", List.of("1", "5"), "thumbs", "vote")
    ), f.entries());
  }

  @Test
  void emptyListsAreKeptButCountAsEmpty() {
    FilterSpec f = FilterSpec.fromNested(Map.of("topics.topics", List.of()));
    assertEquals(1, f.entries().size());
    assertTrue(f.isEmpty());
    assertTrue(FilterSpec.fromNested(null).isEmpty());
  }

  @Test
  void rejectsScalarWhereListExpected() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> FilterSpec.fromNested(Map.of("topics.topics", "a")));
    assertTrue(ex.getMessage().contains("topics.topics"));
  }

  @Test
  void builderKeepsKeyAndSubkey() {
    FilterSpec f = FilterSpec.builder()
        .values("traces.error", List.of("true"))
        .subkeyed("events.metrics.value", "thumbs", "vote", List.of("0", "1"))
        .build();
    assertEquals("thumbs", f.entries().get(1).key());
    assertEquals("vote", f.entries().get(1).subkey());
    assertFalse(f.isEmpty());
  }
}
