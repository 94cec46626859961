package dev.ito.domain.audit;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Fluent builder for {@link AuditEvent}.
 *
 * <p>Stamps {@link AuditEvent#SCHEMA_VERSION} and, unless {@link #timestamp(Instant)} was called, the current
 * time at millisecond precision. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class AuditEventBuilder {
  private Instant timestamp;
  private String entity;
  private String entityId;
  private String scope;
  private String op;
  private String from;
  private String to;
  private String actor;
  private String by;
  private Object meta;
  private EventContext context;

  AuditEventBuilder() {}

  public AuditEventBuilder timestamp(Instant timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  public AuditEventBuilder entity(String entity) {
    this.entity = entity;
    return this;
  }

  public AuditEventBuilder entityId(String entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder scope(String scope) {
    this.scope = scope;
    return this;
  }

  public AuditEventBuilder op(String op) {
    this.op = op;
    return this;
  }

  public AuditEventBuilder from(String from) {
    this.from = from;
    return this;
  }

  public AuditEventBuilder to(String to) {
    this.to = to;
    return this;
  }

  public AuditEventBuilder actor(String actor) {
    this.actor = actor;
    return this;
  }

  public AuditEventBuilder by(String by) {
    this.by = by;
    return this;
  }

  public AuditEventBuilder meta(Object meta) {
    this.meta = meta;
    return this;
  }

  public AuditEventBuilder context(EventContext context) {
    this.context = context;
    return this;
  }

  /**
   * Builds the event.
   *
   * @return immutable event
   * @throws IllegalStateException when entity, entity id, op, actor, by or context is missing
   * @throws IllegalArgumentException when a required string is blank
   */
  public AuditEvent build() {
    require(entity, "entity");
    require(entityId, "entityId");
    require(op, "op");
    require(actor, "actor");
    require(by, "by");
    require(context, "context");
    Instant ts = timestamp != null ? timestamp : Instant.now().truncatedTo(ChronoUnit.MILLIS);
    return new AuditEvent(
        AuditEvent.SCHEMA_VERSION, ts, entity, entityId, scope, op, from, to, actor, by, meta, context);
  }

  private static void require(Object value, String name) {
    if (value == null) {
      throw new IllegalStateException("audit event is missing required field: " + name);
    }
  }
}
