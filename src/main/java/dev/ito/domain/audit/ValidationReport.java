package dev.ito.domain.audit;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of semantic log validation.
 *
 * @param eventCount number of events inspected
 * @param issues findings in event order, file-level findings first
 * @since 0.1.0
 */
public record ValidationReport(int eventCount, List<ValidationIssue> issues) {
  public ValidationReport {
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }

  /**
   * A log is valid when no finding is an error; warnings are informational.
   *
   * @return {@code true} when there are no {@link ValidationIssue.Level#ERROR} findings
   */
  public boolean valid() {
    return issues.stream().noneMatch(issue -> issue.level() == ValidationIssue.Level.ERROR);
  }
}
