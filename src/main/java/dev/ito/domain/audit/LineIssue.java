package dev.ito.domain.audit;

import java.util.Objects;

/**
 * A log line that was skipped while reading.
 *
 * @param lineNumber 1-based physical line number
 * @param kind why the line was skipped
 * @param message decoder diagnostic
 * @since 0.1.0
 */
public record LineIssue(long lineNumber, Kind kind, String message) {
  public LineIssue {
    Objects.requireNonNull(kind, "kind");
    message = message == null ? "" : message;
  }

  /** Distinguishes ordinary corruption from records written by an unknown schema version. */
  public enum Kind {
    MALFORMED,
    UNSUPPORTED_SCHEMA_VERSION
  }
}
