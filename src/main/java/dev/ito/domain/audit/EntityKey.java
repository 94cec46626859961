package dev.ito.domain.audit;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a tracked entity for reconciliation: {@code (entity, entityId, scope)}.
 *
 * @param entity entity kind; never {@code null}
 * @param entityId entity identifier; never {@code null}
 * @param scope containing context; may be {@code null}
 * @since 0.1.0
 */
public record EntityKey(String entity, String entityId, String scope) implements Comparable<EntityKey> {
  private static final Comparator<EntityKey> ORDER = Comparator
      .comparing(EntityKey::entity)
      .thenComparing(EntityKey::entityId)
      .thenComparing(EntityKey::scope, Comparator.nullsFirst(Comparator.naturalOrder()));

  public EntityKey {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(entityId, "entityId");
  }

  @Override
  public int compareTo(EntityKey other) {
    return ORDER.compare(this, other);
  }

  /**
   * Human-readable form, for example {@code task/1.1 (scope: add-login)}.
   *
   * @return display label
   */
  public String display() {
    String base = entity + "/" + entityId;
    return scope == null ? base : base + " (scope: " + scope + ")";
  }
}
