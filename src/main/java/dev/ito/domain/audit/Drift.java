package dev.ito.domain.audit;

import java.util.Objects;

/**
 * One drift entry of a {@link ReconcileReport}.
 *
 * @param key entity key
 * @param kind drift classification
 * @param auditValue value implied by the log; {@code null} for {@link DriftKind#UNLOGGED}
 * @param fileValue value observed in files; {@code null} for {@link DriftKind#ORPHANED}
 * @since 0.1.0
 */
public record Drift(EntityKey key, DriftKind kind, String auditValue, String fileValue) {
  public Drift {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(kind, "kind");
    switch (kind) {
      case DIVERGED -> {
        Objects.requireNonNull(auditValue, "auditValue");
        Objects.requireNonNull(fileValue, "fileValue");
      }
      case UNLOGGED -> {
        Objects.requireNonNull(fileValue, "fileValue");
        if (auditValue != null) {
          throw new IllegalArgumentException("unlogged drift carries no audit value");
        }
      }
      case ORPHANED -> {
        Objects.requireNonNull(auditValue, "auditValue");
        if (fileValue != null) {
          throw new IllegalArgumentException("orphaned drift carries no file value");
        }
      }
      default -> throw new IllegalArgumentException("Unsupported drift kind: " + kind);
    }
  }

  public static Drift diverged(EntityKey key, String auditValue, String fileValue) {
    return new Drift(key, DriftKind.DIVERGED, auditValue, fileValue);
  }

  public static Drift unlogged(EntityKey key, String fileValue) {
    return new Drift(key, DriftKind.UNLOGGED, null, fileValue);
  }

  public static Drift orphaned(EntityKey key, String auditValue) {
    return new Drift(key, DriftKind.ORPHANED, auditValue, null);
  }

  /**
   * Renders the entry for terminal output, e.g. {@code Diverged: task/1.1 (scope: c) audit='a' file='b'}.
   *
   * @return single-line description
   */
  public String describe() {
    StringBuilder sb = new StringBuilder(kind.label()).append(": ").append(key.display());
    if (auditValue != null) {
      sb.append(" audit='").append(auditValue).append('\'');
    }
    if (fileValue != null) {
      sb.append(" file='").append(fileValue).append('\'');
    }
    return sb.toString();
  }
}
