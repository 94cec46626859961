package dev.ito.domain.audit;

import java.util.Objects;

/**
 * Finding produced by semantic validation of a log.
 *
 * @param level severity
 * @param message human-readable description
 * @param eventIndex 0-based index of the offending event, or {@code null} for file-level findings
 * @since 0.1.0
 */
public record ValidationIssue(Level level, String message, Integer eventIndex) {
  public ValidationIssue {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(message, "message");
  }

  public static ValidationIssue warning(String message, int eventIndex) {
    return new ValidationIssue(Level.WARNING, message, eventIndex);
  }

  public static ValidationIssue error(String message) {
    return new ValidationIssue(Level.ERROR, message, null);
  }

  /** Severity of a finding. */
  public enum Level {
    WARNING,
    ERROR
  }
}
