package io.github.themoah.kpiwatch.ingest;

/**
 * A rejected ingestion request. The message is safe to return to the caller.
 */
public class IngestionException extends RuntimeException {

  /**
   * Why the request was rejected.
   */
  public enum Kind {
    MISSING_BODY,
    INVALID_PAYLOAD,
    INVALID_TIMESTAMP,
    INVALID_VALUE
  }

  private final Kind kind;

  public IngestionException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
