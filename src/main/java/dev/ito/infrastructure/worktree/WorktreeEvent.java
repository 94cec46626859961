package dev.ito.infrastructure.worktree;

import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.WorktreeInfo;
import java.util.Objects;

/**
 * Event tagged with the worktree log it came from.
 *
 * @param worktree originating worktree
 * @param position 0-based index among the events read from that worktree's log
 * @param event the event
 * @since 0.1.0
 */
public record WorktreeEvent(WorktreeInfo worktree, int position, AuditEvent event) {
  public WorktreeEvent {
    Objects.requireNonNull(worktree, "worktree");
    Objects.requireNonNull(event, "event");
  }
}
