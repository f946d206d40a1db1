package io.intellixity.insight.clickhouse.filter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Filter fields the translator understands. Anything else is a no-op. */
public enum FilterField {
  TOPICS("topics.topics"),
  SUBTOPICS("topics.subtopics"),
  USER_ID("metadata.user_id"),
  THREAD_ID("metadata.thread_id"),
  CUSTOMER_ID("metadata.customer_id"),
  LABELS("metadata.labels"),
  METADATA_KEY("metadata.key"),
  METADATA_VALUE("metadata.value"),
  PROMPT_IDS("metadata.prompt_ids"),
  ERROR("traces.error"),
  SPAN_TYPE("spans.type"),
  SPAN_MODEL("spans.model"),
  EVALUATOR_ID("evaluations.evaluator_id"),
  EVALUATOR_ID_GUARDRAILS_ONLY("evaluations.evaluator_id.guardrails_only"),
  EVALUATION_PASSED("evaluations.passed"),
  EVALUATION_SCORE("evaluations.score"),
  EVALUATION_LABEL("evaluations.label"),
  EVALUATION_STATE("evaluations.state"),
  EVENT_TYPE("events.event_type"),
  EVENT_METRIC_KEY("events.metrics.key"),
  EVENT_METRIC_VALUE("events.metrics.value"),
  EVENT_DETAIL_KEY("events.event_details.key"),
  HAS_ANNOTATION("annotations.hasAnnotation");

  private static final Map<String, FilterField> BY_ID = new HashMap<>();

  static {
    for (FilterField f : values()) BY_ID.put(f.id, f);
  }

  private final String id;

  FilterField(String id) {
    this.id = id;
  }

  public String id() { return id; }

  public static Optional<FilterField> fromId(String id) {
    return Optional.ofNullable(id == null ? null : BY_ID.get(id));
  }
}
