package dev.ito.domain.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Compares log-implied entity state against a {@link FileState} snapshot.
 *
 * <p><strong>What:</strong> For every key present on either side, the log value (from
 * {@link StateMaterializer}) is compared to the file value. Equal values produce nothing; differing values
 * produce {@link DriftKind#DIVERGED}; file-only keys produce {@link DriftKind#UNLOGGED}; log-only keys produce
 * {@link DriftKind#ORPHANED}.</p>
 * <p><strong>Side effects:</strong> None. The engine neither reads nor writes the log or the files.</p>
 * <p><strong>Ordering:</strong> Entries are sorted by {@link EntityKey} so identical inputs produce identical
 * reports.</p>
 *
 * @since 0.1.0
 */
public final class ReconcileEngine {
  private ReconcileEngine() {
    // Utility
  }

  /**
   * Runs one reconciliation pass.
   *
   * @param logEvents events in physical log order
   * @param fileState observed state
   * @return drift report
   */
  public static ReconcileReport run(List<AuditEvent> logEvents, FileState fileState) {
    Objects.requireNonNull(logEvents, "logEvents");
    Objects.requireNonNull(fileState, "fileState");
    AuditState auditState = StateMaterializer.materialize(logEvents);
    Map<EntityKey, String> audit = auditState.entities();
    Map<EntityKey, String> files = fileState.entries();

    TreeSet<EntityKey> keys = new TreeSet<>(audit.keySet());
    keys.addAll(files.keySet());

    List<Drift> drifts = new ArrayList<>();
    for (EntityKey key : keys) {
      String auditValue = audit.get(key);
      String fileValue = files.get(key);
      if (auditValue == null) {
        drifts.add(Drift.unlogged(key, fileValue));
      } else if (fileValue == null) {
        drifts.add(Drift.orphaned(key, auditValue));
      } else if (!auditValue.equals(fileValue)) {
        drifts.add(Drift.diverged(key, auditValue, fileValue));
      }
    }
    return new ReconcileReport(drifts, logEvents.size(), files.size());
  }
}
