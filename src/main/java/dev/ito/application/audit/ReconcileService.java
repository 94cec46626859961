package dev.ito.application.audit;

import dev.ito.application.port.AuditEventSource;
import dev.ito.application.port.FileStateSource;
import dev.ito.application.port.MetricsPort;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.CompensatingEvents;
import dev.ito.domain.audit.EntityTypes;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.FileState;
import dev.ito.domain.audit.ReadResult;
import dev.ito.domain.audit.ReconcileEngine;
import dev.ito.domain.audit.ReconcileInputException;
import dev.ito.domain.audit.ReconcileReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reconciles task state recorded in the audit log against the tasks files.
 * <p><strong>Flow:</strong> read task events (scoped to one change, or to every active change), derive the file
 * state, run {@link ReconcileEngine}, and, when fixing, append compensating events.</p>
 * <p><strong>Failures:</strong> A file-state failure surfaces as {@link ReconcileInputException}; no report is
 * produced from a partial snapshot. Log read and append failures surface as {@link IOException}.</p>
 * <p><strong>Observability:</strong> Counts {@code audit.reconcile.drift} per drift entry.</p>
 *
 * @since 0.1.0
 */
public final class ReconcileService {
  private static final Logger log = LoggerFactory.getLogger(ReconcileService.class);

  private final AuditEventSource events;
  private final FileStateSource files;
  private final Path itoDir;
  private final MetricsPort metrics;

  public ReconcileService(AuditEventSource events, FileStateSource files, Path itoDir, MetricsPort metrics) {
    this.events = Objects.requireNonNull(events, "events");
    this.files = Objects.requireNonNull(files, "files");
    this.itoDir = Objects.requireNonNull(itoDir, "itoDir");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs reconciliation.
   *
   * @param changeId change to reconcile; empty reconciles every active change
   * @param fix append compensating events for every drift entry
   * @param context writer and identity used when fixing
   * @return report plus bookkeeping
   * @throws ReconcileInputException when the tasks files cannot be turned into a snapshot
   * @throws IOException when the log cannot be read or a compensating event cannot be appended
   */
  public Outcome reconcile(Optional<String> changeId, boolean fix, AuditContext context)
      throws ReconcileInputException, IOException {
    Objects.requireNonNull(changeId, "changeId");
    Objects.requireNonNull(context, "context");
    FileState fileState = files.load(itoDir, changeId);

    EventFilter.Builder filter = EventFilter.builder().entity(EntityTypes.TASK);
    changeId.ifPresent(filter::scope);
    ReadResult read = events.read(filter.build());
    List<AuditEvent> scoped = read.events();
    if (changeId.isEmpty()) {
      // Archived changes are not scanned; unscoped events have no change to belong to and stay in.
      Set<String> scanned = fileState.scopes();
      scoped = scoped.stream().filter(e -> e.scope() == null || scanned.contains(e.scope())).toList();
    }

    ReconcileReport report = ReconcileEngine.run(scoped, fileState);
    report.drifts().forEach(drift -> metrics.increment("audit.reconcile.drift"));
    String scopeLabel = changeId.orElse("project");
    log.info("Reconciled {}: {} event(s), {} file entit(ies), {} drift(s)",
        scopeLabel, report.logEventCount(), report.fileEntityCount(), report.drifts().size());

    int written = 0;
    if (fix && !report.isClean()) {
      for (AuditEvent event : CompensatingEvents.forReport(report, context.eventContext(), context.now())) {
        context.writer().append(event);
        written++;
      }
      log.info("Wrote {} compensating event(s) for {}", written, scopeLabel);
    }
    return new Outcome(report, written, scopeLabel, read.issues().size());
  }

  /**
   * Reconciliation result.
   *
   * @param report drift report
   * @param eventsWritten compensating events appended; {@code 0} without fixing
   * @param scope change id or {@code project}
   * @param skippedLines unreadable log lines ignored while reading
   */
  public record Outcome(ReconcileReport report, int eventsWritten, String scope, int skippedLines) {
    public Outcome {
      Objects.requireNonNull(report, "report");
      Objects.requireNonNull(scope, "scope");
    }

    /**
     * Drift remains when some was found and none was compensated.
     *
     * @return {@code true} when the caller should report failure
     */
    public boolean hasUnresolvedDrift() {
      return !report.isClean() && eventsWritten == 0;
    }
  }
}
