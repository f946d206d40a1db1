package io.intellixity.insight.query;

/**
 * Raised when an analytics request carries values that cannot be compiled safely
 * (malformed range bounds, missing tenant, unknown aggregation).
 * <p>
 * Unknown filter/metric/group-by fields are not validation errors; they degrade to fallbacks.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
