package dev.ito.application.audit;

import dev.ito.domain.audit.AuditEvent;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Event counts of a log grouped by entity, op, actor and scope.
 *
 * @param total number of events
 * @param byEntity counts per entity kind
 * @param byOp counts per operation
 * @param byActor counts per actor category
 * @param byScope counts per scope; events without scope are not counted here
 * @since 0.1.0
 */
public record AuditStats(
    int total,
    Map<String, Long> byEntity,
    Map<String, Long> byOp,
    Map<String, Long> byActor,
    Map<String, Long> byScope) {

  public AuditStats {
    byEntity = sorted(byEntity);
    byOp = sorted(byOp);
    byActor = sorted(byActor);
    byScope = sorted(byScope);
  }

  public static AuditStats compute(List<AuditEvent> events) {
    Objects.requireNonNull(events, "events");
    return new AuditStats(
        events.size(),
        count(events, AuditEvent::entity),
        count(events, AuditEvent::op),
        count(events, AuditEvent::actor),
        count(events, AuditEvent::scope));
  }

  private static Map<String, Long> count(List<AuditEvent> events, Function<AuditEvent, String> field) {
    Map<String, Long> counts = new TreeMap<>();
    for (AuditEvent event : events) {
      String value = field.apply(event);
      if (value != null) {
        counts.merge(value, 1L, Long::sum);
      }
    }
    return counts;
  }

  private static Map<String, Long> sorted(Map<String, Long> counts) {
    return Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(counts, "counts")));
  }
}
