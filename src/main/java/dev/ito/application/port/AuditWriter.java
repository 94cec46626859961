package dev.ito.application.port;

import dev.ito.domain.audit.AuditEvent;
import java.io.IOException;

/**
 * <strong>What:</strong> Port that appends one audit event to the active audit log.
 * <p><strong>Why:</strong> Domain operations record every state transition without knowing whether a durable
 * log, a discarding writer, or an in-memory fake is wired in.</p>
 * <p><strong>Role:</strong> Writer port; adapters live in {@code dev.ito.infrastructure.audit}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist the event as one line, never rewriting or reordering earlier lines.</li>
 *   <li>Return only after the line is observable by subsequent readers.</li>
 *   <li>Report every failed durable write to the caller.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from several callers and from other
 * processes appending to the same file.</p>
 * <p><strong>Observability:</strong> Durable adapters count {@code audit.append.success} and
 * {@code audit.append.failure}.</p>
 *
 * @since 0.1.0
 */
public interface AuditWriter {
  /**
   * Appends an event.
   *
   * @param event event to persist; never {@code null}
   * @throws IOException when the durable write fails (permission, disk full, missing path)
   */
  void append(AuditEvent event) throws IOException;

  /**
   * Writer that discards every event.
   */
  AuditWriter NO_OP = event -> {};
}
