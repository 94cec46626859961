package dev.ito.domain.audit;

import java.time.Instant;

/**
 * Predicate over audit events; every {@code null} component matches anything.
 *
 * <p>The time range is inclusive on both ends.</p>
 *
 * @param entity required entity kind
 * @param entityId required entity id
 * @param scope required scope
 * @param op required operation
 * @param actor required actor category
 * @param since earliest accepted timestamp
 * @param until latest accepted timestamp
 * @since 0.1.0
 */
public record EventFilter(
    String entity,
    String entityId,
    String scope,
    String op,
    String actor,
    Instant since,
    Instant until) {

  private static final EventFilter ALL = new EventFilter(null, null, null, null, null, null, null);

  public EventFilter {
    if (since != null && until != null && since.isAfter(until)) {
      throw new IllegalArgumentException("since must not be after until");
    }
  }

  /**
   * Filter accepting every event.
   *
   * @return match-all filter
   */
  public static EventFilter all() {
    return ALL;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Tests an event against every set component.
   *
   * @param event candidate event
   * @return {@code true} when all set components match
   */
  public boolean matches(AuditEvent event) {
    if (entity != null && !entity.equals(event.entity())) {
      return false;
    }
    if (entityId != null && !entityId.equals(event.entityId())) {
      return false;
    }
    if (scope != null && !scope.equals(event.scope())) {
      return false;
    }
    if (op != null && !op.equals(event.op())) {
      return false;
    }
    if (actor != null && !actor.equals(event.actor())) {
      return false;
    }
    if (since != null && event.timestamp().isBefore(since)) {
      return false;
    }
    return until == null || !event.timestamp().isAfter(until);
  }

  /**
   * Returns whether no component is set.
   *
   * @return {@code true} for a match-all filter
   */
  public boolean isEmpty() {
    return equals(ALL);
  }

  /** Mutable builder for {@link EventFilter}. */
  public static final class Builder {
    private String entity;
    private String entityId;
    private String scope;
    private String op;
    private String actor;
    private Instant since;
    private Instant until;

    private Builder() {}

    public Builder entity(String entity) {
      this.entity = entity;
      return this;
    }

    public Builder entityId(String entityId) {
      this.entityId = entityId;
      return this;
    }

    public Builder scope(String scope) {
      this.scope = scope;
      return this;
    }

    public Builder op(String op) {
      this.op = op;
      return this;
    }

    public Builder actor(String actor) {
      this.actor = actor;
      return this;
    }

    public Builder since(Instant since) {
      this.since = since;
      return this;
    }

    public Builder until(Instant until) {
      this.until = until;
      return this;
    }

    public EventFilter build() {
      return new EventFilter(entity, entityId, scope, op, actor, since, until);
    }
  }
}
