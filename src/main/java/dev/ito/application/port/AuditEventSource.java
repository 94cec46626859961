package dev.ito.application.port;

import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.ReadResult;
import java.io.IOException;

/**
 * Read-only access to the active audit log.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AuditEventSource {
  /**
   * Reads the events accepted by {@code filter} in log order.
   *
   * @param filter event predicate
   * @return matching events and skipped lines
   * @throws IOException when the log exists but cannot be read
   */
  ReadResult read(EventFilter filter) throws IOException;
}
