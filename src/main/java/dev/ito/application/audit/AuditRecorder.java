package dev.ito.application.audit;

import dev.ito.domain.audit.AuditEvent;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records state transitions on behalf of domain operations.
 *
 * <p>Stamps timestamp, context and identity from the {@link AuditContext} and appends through its writer.
 * Append failures propagate; whether they abort the triggering operation is the caller's decision.</p>
 *
 * @since 0.1.0
 */
public final class AuditRecorder {
  private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

  private final AuditContext context;

  public AuditRecorder(AuditContext context) {
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Records one transition.
   *
   * @param transition what changed
   * @return the appended event
   * @throws IOException when the durable append fails
   */
  public AuditEvent record(Transition transition) throws IOException {
    Objects.requireNonNull(transition, "transition");
    AuditEvent event = AuditEvent.builder()
        .timestamp(context.now())
        .entity(transition.entity())
        .entityId(transition.entityId())
        .scope(transition.scope())
        .op(transition.op())
        .from(transition.from())
        .to(transition.to())
        .actor(transition.actor())
        .by(transition.by() != null ? transition.by() : context.identity())
        .meta(transition.meta())
        .context(context.eventContext())
        .build();
    context.writer().append(event);
    log.debug("Recorded {} {}", event.op(), event.key().display());
    return event;
  }

  /**
   * Description of a state transition before it is stamped.
   *
   * @param entity entity kind
   * @param entityId entity id
   * @param scope containing context; may be {@code null}
   * @param op operation
   * @param from prior value; may be {@code null}
   * @param to new value; may be {@code null}
   * @param actor actor category
   * @param by explicit identity; {@code null} uses the context identity
   * @param meta free-form metadata; may be {@code null}
   */
  public record Transition(
      String entity,
      String entityId,
      String scope,
      String op,
      String from,
      String to,
      String actor,
      String by,
      Object meta) {}
}
