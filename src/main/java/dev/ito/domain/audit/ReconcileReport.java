package dev.ito.domain.audit;

import java.util.List;
import java.util.Objects;

/**
 * Result of one reconciliation pass.
 *
 * @param drifts drift entries sorted by entity key
 * @param logEventCount number of log events considered
 * @param fileEntityCount number of entities observed in files
 * @since 0.1.0
 */
public record ReconcileReport(List<Drift> drifts, int logEventCount, int fileEntityCount) {
  public ReconcileReport {
    drifts = List.copyOf(Objects.requireNonNull(drifts, "drifts"));
  }

  public boolean isClean() {
    return drifts.isEmpty();
  }

  public long count(DriftKind kind) {
    return drifts.stream().filter(d -> d.kind() == kind).count();
  }
}
