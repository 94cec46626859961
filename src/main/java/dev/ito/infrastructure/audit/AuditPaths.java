package dev.ito.infrastructure.audit;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of the audit log below a project's state directory.
 *
 * <pre>
 * &lt;project&gt;/.ito/.state/audit/events.jsonl
 * &lt;project&gt;/.ito/.state/audit/.session
 * </pre>
 *
 * @since 0.1.0
 */
public final class AuditPaths {
  /** Default name of the state directory at the project root. */
  public static final String DEFAULT_ITO_DIR = ".ito";
  static final String STATE_DIR = ".state";
  static final String AUDIT_DIR = "audit";
  static final String LOG_FILE = "events.jsonl";
  static final String SESSION_FILE = ".session";

  private AuditPaths() {
    // Utility
  }

  public static Path auditDir(Path itoDir) {
    return Objects.requireNonNull(itoDir, "itoDir").resolve(STATE_DIR).resolve(AUDIT_DIR);
  }

  public static Path logFile(Path itoDir) {
    return auditDir(itoDir).resolve(LOG_FILE);
  }

  public static Path sessionFile(Path itoDir) {
    return auditDir(itoDir).resolve(SESSION_FILE);
  }

  /**
   * Log file of a worktree, whose state directory sits at its root.
   *
   * @param worktree worktree directory
   * @param itoDirName state directory name, usually {@value #DEFAULT_ITO_DIR}
   * @return log path (may not exist)
   */
  public static Path logFileForWorktree(Path worktree, String itoDirName) {
    Objects.requireNonNull(worktree, "worktree");
    return logFile(worktree.resolve(Objects.requireNonNull(itoDirName, "itoDirName")));
  }
}
