package dev.ito.domain.audit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replays events in log order to derive the last-known value of every entity.
 *
 * <p>Rules, applied per event (the latest event for a key wins):</p>
 * <ul>
 *   <li>{@code to} present: the key takes that value.</li>
 *   <li>{@code archive} without {@code to}: the key becomes {@value AuditOps#ARCHIVED_STATE}.</li>
 *   <li>{@code reconciled} without {@code to}: the key is dropped (compensation for a log-only entity).</li>
 *   <li>any other event without {@code to} (notes, decisions): the value is unchanged.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class StateMaterializer {
  private StateMaterializer() {
    // Utility
  }

  /**
   * Materializes the state implied by {@code events}.
   *
   * @param events events in physical log order
   * @return derived state
   */
  public static AuditState materialize(List<AuditEvent> events) {
    Objects.requireNonNull(events, "events");
    Map<EntityKey, String> entities = new HashMap<>();
    for (AuditEvent event : events) {
      EntityKey key = event.key();
      if (event.to() != null) {
        entities.put(key, event.to());
      } else if (AuditOps.ARCHIVE.equals(event.op())) {
        entities.put(key, AuditOps.ARCHIVED_STATE);
      } else if (AuditOps.RECONCILED.equals(event.op())) {
        entities.remove(key);
      }
    }
    return new AuditState(entities, events.size());
  }
}
