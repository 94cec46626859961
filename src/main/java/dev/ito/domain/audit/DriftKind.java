package dev.ito.domain.audit;

/**
 * Classification of a discrepancy between log-implied and file-observed state.
 *
 * @since 0.1.0
 */
public enum DriftKind {
  /** Both sides know the key but disagree on its value. */
  DIVERGED("Diverged"),
  /** Key observed in the files but never logged. */
  UNLOGGED("Unlogged"),
  /** Key implied by the log but absent from the files. */
  ORPHANED("Orphaned");

  private final String label;

  DriftKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
