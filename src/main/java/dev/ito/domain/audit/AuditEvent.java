package dev.ito.domain.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of a single state transition of a tracked entity.
 *
 * <p><strong>What:</strong> One line of the append-only audit log. Events are never edited once appended;
 * physical order inside one log file is the authoritative per-worktree order, even when timestamps are not
 * monotonic.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link #meta()} is deep-copied into unmodifiable collections.</p>
 *
 * @param schemaVersion record format version; {@link #SCHEMA_VERSION} for events produced by this build
 * @param timestamp producer-assigned wall-clock time in UTC; never {@code null}
 * @param entity kind of tracked thing (see {@link EntityTypes}); never blank
 * @param entityId identifier of the entity, for example task id {@code 1.1}; never blank
 * @param scope containing context such as a change id; may be {@code null}
 * @param op transition verb (see {@link AuditOps}); never blank
 * @param from prior value; {@code null} for creation events
 * @param to new value; {@code null} for deletion-only events
 * @param actor actor category (see {@link AuditActors}); never blank
 * @param by concrete actor identity, for example {@code @jane-doe}; never blank
 * @param meta free-form JSON-compatible value (maps, lists, strings, numbers, booleans); may be {@code null}
 * @param context correlation fields; never {@code null}
 *
 * @since 0.1.0
 */
public record AuditEvent(
    int schemaVersion,
    Instant timestamp,
    String entity,
    String entityId,
    String scope,
    String op,
    String from,
    String to,
    String actor,
    String by,
    Object meta,
    EventContext context) {

  /** Schema version written by this build and the only one readers accept. */
  public static final int SCHEMA_VERSION = 1;

  /**
   * Validates required fields and freezes the metadata graph.
   */
  public AuditEvent {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    entity = requireText("entity", entity);
    entityId = requireText("entityId", entityId);
    op = requireText("op", op);
    actor = requireText("actor", actor);
    by = requireText("by", by);
    context = Objects.requireNonNull(context, "context");
    meta = MetaValues.freeze(meta);
  }

  /**
   * Returns the reconciliation key of this event.
   *
   * @return key composed of entity, entity id and scope
   */
  public EntityKey key() {
    return new EntityKey(entity, entityId, scope);
  }

  /**
   * Starts a builder that stamps the current schema version and timestamp on {@code build()}.
   *
   * @return new builder
   */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  private static String requireText(String name, String value) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }
}
