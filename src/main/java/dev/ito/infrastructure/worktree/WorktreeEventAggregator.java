package dev.ito.infrastructure.worktree;

import dev.ito.application.port.MetricsPort;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.ReadResult;
import dev.ito.domain.audit.WorktreeInfo;
import dev.ito.infrastructure.audit.AuditLogReader;
import dev.ito.infrastructure.audit.AuditPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges per-worktree audit logs into one deterministic timeline.
 *
 * <p><strong>Ordering:</strong> timestamp, then worktree id, then position within that worktree's log.
 * Clocks across worktrees are not assumed synchronized; the tie-breaks only make the order reproducible.</p>
 * <p><strong>Failures:</strong> A worktree whose log is missing or unreadable is reported in
 * {@link AggregatedEvents#excluded()} and contributes no events; the aggregate itself does not fail.</p>
 *
 * @since 0.1.0
 */
public final class WorktreeEventAggregator {
  private static final Logger log = LoggerFactory.getLogger(WorktreeEventAggregator.class);
  static final Comparator<WorktreeEvent> ORDER = Comparator
      .comparing((WorktreeEvent e) -> e.event().timestamp())
      .thenComparing(e -> e.worktree().id())
      .thenComparingInt(WorktreeEvent::position);

  private final AuditLogReader reader;
  private final String itoDirName;
  private final MetricsPort metrics;

  public WorktreeEventAggregator(AuditLogReader reader, String itoDirName, MetricsPort metrics) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.itoDirName = Objects.requireNonNull(itoDirName, "itoDirName");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Aggregates every event of every worktree.
   *
   * @param worktrees worktrees to merge
   * @return merged timeline and exclusions
   */
  public AggregatedEvents aggregate(List<WorktreeInfo> worktrees) {
    return aggregate(worktrees, EventFilter.all());
  }

  /**
   * Aggregates the events accepted by {@code filter}.
   *
   * @param worktrees worktrees to merge
   * @param filter event predicate applied per log
   * @return merged timeline and exclusions
   */
  public AggregatedEvents aggregate(List<WorktreeInfo> worktrees, EventFilter filter) {
    Objects.requireNonNull(worktrees, "worktrees");
    Objects.requireNonNull(filter, "filter");
    List<WorktreeEvent> merged = new ArrayList<>();
    List<ExcludedWorktree> excluded = new ArrayList<>();
    long skipped = 0;
    for (WorktreeInfo worktree : worktrees) {
      Path logFile = AuditPaths.logFileForWorktree(worktree.path(), itoDirName);
      if (!Files.isRegularFile(logFile)) {
        excluded.add(exclude(worktree, "no audit log at " + logFile));
        continue;
      }
      ReadResult result;
      try {
        result = reader.readFiltered(logFile, filter);
      } catch (IOException ex) {
        excluded.add(exclude(worktree, "unreadable audit log " + logFile + ": " + ex.getMessage()));
        continue;
      }
      skipped += result.issues().size();
      for (int i = 0; i < result.events().size(); i++) {
        merged.add(new WorktreeEvent(worktree, i, result.events().get(i)));
      }
    }
    merged.sort(ORDER);
    return new AggregatedEvents(merged, excluded, skipped);
  }

  private ExcludedWorktree exclude(WorktreeInfo worktree, String reason) {
    metrics.increment("audit.aggregate.excluded");
    log.warn("Excluding worktree {} from audit aggregate: {}", worktree.id(), reason);
    return new ExcludedWorktree(worktree, reason);
  }
}
