package dev.ito.domain.audit;

import java.util.Objects;

/**
 * Audit event delivered by the stream watcher.
 *
 * @param event decoded event
 * @param cursor position just after this event's line; resuming from it skips the event
 * @param source label of the originating log, for example a worktree branch
 * @since 0.1.0
 */
public record StreamEvent(AuditEvent event, StreamCursor cursor, String source) {
  public StreamEvent {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(cursor, "cursor");
    Objects.requireNonNull(source, "source");
  }
}
