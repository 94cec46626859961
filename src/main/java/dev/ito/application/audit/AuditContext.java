package dev.ito.application.audit;

import dev.ito.application.port.AuditWriter;
import dev.ito.application.port.ClockPort;
import dev.ito.domain.audit.AuditTimestamps;
import dev.ito.domain.audit.EventContext;
import java.time.Instant;
import java.util.Objects;

/**
 * Audit state handed explicitly to every operation that records events.
 *
 * <p>Replaces any process-wide "current writer": tests build a context with
 * {@link AuditWriter#NO_OP} or an in-memory writer and a fixed clock.</p>
 *
 * @param writer active writer
 * @param eventContext correlation fields stamped on new events
 * @param identity default {@code by} value, for example {@code @jane-doe}
 * @param clock time source for timestamps
 * @since 0.1.0
 */
public record AuditContext(AuditWriter writer, EventContext eventContext, String identity, ClockPort clock) {
  public AuditContext {
    Objects.requireNonNull(writer, "writer");
    Objects.requireNonNull(eventContext, "eventContext");
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(clock, "clock");
  }

  /**
   * Current time at the precision written to the log.
   *
   * @return timestamp for a new event
   */
  public Instant now() {
    return AuditTimestamps.ofEpochMillis(clock.nowMillis());
  }

  public AuditContext withWriter(AuditWriter replacement) {
    return new AuditContext(replacement, eventContext, identity, clock);
  }
}
