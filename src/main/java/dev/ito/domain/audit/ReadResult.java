package dev.ito.domain.audit;

import java.util.List;
import java.util.Objects;

/**
 * Events read from one log plus the lines that were skipped.
 *
 * @param events decoded events in physical order
 * @param issues skipped lines in physical order
 * @since 0.1.0
 */
public record ReadResult(List<AuditEvent> events, List<LineIssue> issues) {
  private static final ReadResult EMPTY = new ReadResult(List.of(), List.of());

  public ReadResult {
    events = List.copyOf(Objects.requireNonNull(events, "events"));
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }

  public static ReadResult empty() {
    return EMPTY;
  }

  /**
   * Number of lines skipped as malformed.
   *
   * @return malformed line count
   */
  public long skippedLines() {
    return count(LineIssue.Kind.MALFORMED);
  }

  /**
   * Number of lines skipped because their schema version is not understood.
   *
   * @return unsupported version line count
   */
  public long unsupportedVersionLines() {
    return count(LineIssue.Kind.UNSUPPORTED_SCHEMA_VERSION);
  }

  public boolean hasIssues() {
    return !issues.isEmpty();
  }

  private long count(LineIssue.Kind kind) {
    return issues.stream().filter(issue -> issue.kind() == kind).count();
  }
}
