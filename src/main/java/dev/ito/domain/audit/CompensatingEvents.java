package dev.ito.domain.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@code reconciled} events that bring the log in line with the files.
 *
 * <p>Each event carries {@code from} = log value and {@code to} = file value. An orphaned entry gets no
 * {@code to}, which {@link StateMaterializer} treats as removal.</p>
 *
 * @since 0.1.0
 */
public final class CompensatingEvents {
  private CompensatingEvents() {
    // Utility
  }

  /**
   * Creates one compensating event per drift entry.
   *
   * @param report reconciliation result
   * @param context correlation context of the reconciling process
   * @param timestamp timestamp stamped on every event
   * @return events in report order; empty for a clean report
   */
  public static List<AuditEvent> forReport(ReconcileReport report, EventContext context, Instant timestamp) {
    Objects.requireNonNull(report, "report");
    List<AuditEvent> events = new ArrayList<>(report.drifts().size());
    for (Drift drift : report.drifts()) {
      events.add(forDrift(drift, context, timestamp));
    }
    return List.copyOf(events);
  }

  /**
   * Creates the compensating event for one drift entry.
   *
   * @param drift drift entry
   * @param context correlation context
   * @param timestamp event timestamp
   * @return compensating event
   */
  public static AuditEvent forDrift(Drift drift, EventContext context, Instant timestamp) {
    Objects.requireNonNull(drift, "drift");
    EntityKey key = drift.key();
    return AuditEvent.builder()
        .timestamp(timestamp)
        .entity(key.entity())
        .entityId(key.entityId())
        .scope(key.scope())
        .op(AuditOps.RECONCILED)
        .from(drift.auditValue())
        .to(drift.fileValue())
        .actor(AuditActors.RECONCILE)
        .by(AuditActors.RECONCILE_IDENTITY)
        .meta(Map.of("reason", reason(drift)))
        .context(context)
        .build();
  }

  private static String reason(Drift drift) {
    return switch (drift.kind()) {
      case DIVERGED -> "audit log value differed from file value";
      case UNLOGGED -> "entity present in files but never logged";
      case ORPHANED -> "entity logged but no longer present in files";
    };
  }
}
