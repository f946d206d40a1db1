package io.intellixity.insight.compile;

import java.util.Objects;

/** Ranked document listing plus the distinct-document total, executed as two statements. */
public record TopDocumentsQuery(BuiltQuery documents, BuiltQuery total) {
  public TopDocumentsQuery {
    Objects.requireNonNull(documents, "documents");
    Objects.requireNonNull(total, "total");
  }
}
