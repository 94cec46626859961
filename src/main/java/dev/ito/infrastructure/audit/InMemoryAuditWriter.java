package dev.ito.infrastructure.audit;

import dev.ito.application.port.AuditWriter;
import dev.ito.domain.audit.AuditEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Writer that keeps appended events in memory, primarily for tests and dry runs.
 *
 * @since 0.1.0
 */
public final class InMemoryAuditWriter implements AuditWriter {
  private final CopyOnWriteArrayList<AuditEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void append(AuditEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns the appended events in order.
   *
   * @return immutable snapshot
   */
  public List<AuditEvent> snapshot() {
    return List.copyOf(events);
  }

  public void clear() {
    events.clear();
  }
}
