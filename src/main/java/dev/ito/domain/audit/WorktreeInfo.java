package dev.ito.domain.audit;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Descriptor of one working tree that shares the project repository.
 *
 * @param path absolute worktree directory; never {@code null}
 * @param branch checked-out branch without {@code refs/heads/}; {@code null} when detached
 * @param main whether this is the repository's main worktree
 * @since 0.1.0
 */
public record WorktreeInfo(Path path, String branch, boolean main) {
  public WorktreeInfo {
    Objects.requireNonNull(path, "path");
  }

  /**
   * Stable identifier used to break timestamp ties during aggregation.
   *
   * @return the worktree path as text
   */
  public String id() {
    return path.toString();
  }

  /**
   * Short label for terminal output: the branch, or the directory name when detached.
   *
   * @return display label
   */
  public String label() {
    if (branch != null) {
      return branch;
    }
    Path name = path.getFileName();
    return name == null ? path.toString() : name.toString();
  }
}
