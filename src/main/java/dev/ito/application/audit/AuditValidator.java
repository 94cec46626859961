package dev.ito.application.audit;

import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.AuditOps;
import dev.ito.domain.audit.EntityKey;
import dev.ito.domain.audit.LineIssue;
import dev.ito.domain.audit.ReadResult;
import dev.ito.domain.audit.ValidationIssue;
import dev.ito.domain.audit.ValidationReport;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic checks over a log.
 *
 * <p>Unreadable lines are errors. Duplicate creations, status transitions whose {@code from} disagrees with the
 * previous value, and timestamps that go backwards are warnings, since clock skew and hand edits happen.</p>
 *
 * @since 0.1.0
 */
public final class AuditValidator {
  private AuditValidator() {
    // Utility
  }

  public static ValidationReport validate(ReadResult read) {
    Objects.requireNonNull(read, "read");
    List<ValidationIssue> issues = new ArrayList<>();
    for (LineIssue line : read.issues()) {
      String what = line.kind() == LineIssue.Kind.UNSUPPORTED_SCHEMA_VERSION
          ? "Unsupported record on line"
          : "Corrupt line";
      issues.add(ValidationIssue.error(what + " " + line.lineNumber() + ": " + line.message()));
    }
    issues.addAll(validate(read.events()).issues());
    return new ValidationReport(read.events().size(), issues);
  }

  public static ValidationReport validate(List<AuditEvent> events) {
    Objects.requireNonNull(events, "events");
    List<ValidationIssue> issues = new ArrayList<>();
    Set<EntityKey> created = new HashSet<>();
    Map<EntityKey, String> lastValue = new HashMap<>();
    Instant previous = null;
    for (int i = 0; i < events.size(); i++) {
      AuditEvent event = events.get(i);
      EntityKey key = event.key();

      if (AuditOps.isCreation(event.op()) && !created.add(key)) {
        issues.add(ValidationIssue.warning(
            "Duplicate " + event.op() + " for " + key.display(), i));
      }
      if (AuditOps.isStatusTransition(event.op()) && event.from() != null) {
        String known = lastValue.get(key);
        if (known != null && !known.equals(event.from())) {
          issues.add(ValidationIssue.warning(
              "Status transition for " + key.display() + " starts from '" + event.from()
                  + "' but last known status is '" + known + "'", i));
        }
      }
      if (previous != null && event.timestamp().isBefore(previous)) {
        issues.add(ValidationIssue.warning(
            "Timestamp of event " + i + " is earlier than the previous event", i));
      }

      if (event.to() != null) {
        lastValue.put(key, event.to());
      }
      previous = event.timestamp();
    }
    return new ValidationReport(events.size(), issues);
  }
}
