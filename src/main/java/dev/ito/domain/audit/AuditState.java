package dev.ito.domain.audit;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entity values implied by replaying an audit log.
 *
 * @param entities last-known value per key
 * @param eventCount number of events replayed
 * @since 0.1.0
 */
public record AuditState(Map<EntityKey, String> entities, int eventCount) {
  public AuditState {
    entities = Map.copyOf(Objects.requireNonNull(entities, "entities"));
  }

  public Optional<String> valueOf(EntityKey key) {
    return Optional.ofNullable(entities.get(key));
  }
}
