package dev.ito.infrastructure.worktree;

import dev.ito.domain.audit.AuditEvent;
import java.util.List;
import java.util.Objects;

/**
 * Merged timeline across worktrees.
 *
 * @param events events in aggregate order
 * @param excluded worktrees that contributed nothing, with reasons
 * @param skippedLines unreadable lines across all included logs
 * @since 0.1.0
 */
public record AggregatedEvents(
    List<WorktreeEvent> events, List<ExcludedWorktree> excluded, long skippedLines) {
  public AggregatedEvents {
    events = List.copyOf(Objects.requireNonNull(events, "events"));
    excluded = List.copyOf(Objects.requireNonNull(excluded, "excluded"));
  }

  /**
   * Plain events in aggregate order.
   *
   * @return events without worktree tags
   */
  public List<AuditEvent> auditEvents() {
    return events.stream().map(WorktreeEvent::event).toList();
  }
}
