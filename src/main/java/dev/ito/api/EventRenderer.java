package dev.ito.api;

import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.AuditTimestamps;

/**
 * One-line terminal rendering of audit events.
 *
 * <p>Example: {@code 2026-03-01T10:15:00.000Z  task/1.1 (scope: add-auth)  status_change pending -> complete
 * [cli @jane-doe]}.</p>
 */
final class EventRenderer {

  private EventRenderer() {
    // Utility
  }

  static String text(AuditEvent event) {
    StringBuilder line = new StringBuilder(128)
        .append(AuditTimestamps.format(event.timestamp()))
        .append("  ")
        .append(event.key().display())
        .append("  ")
        .append(event.op());
    if (event.from() != null || event.to() != null) {
      line.append(' ')
          .append(event.from() == null ? "" : event.from() + ' ')
          .append("-> ")
          .append(event.to() == null ? "(none)" : event.to());
    }
    return line.append("  [").append(event.actor()).append(' ').append(event.by()).append(']').toString();
  }

  static String text(AuditEvent event, String source) {
    return source == null || source.isBlank() ? text(event) : "(" + source + ") " + text(event);
  }
}
