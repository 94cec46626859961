package dev.ito.infrastructure.worktree;

import dev.ito.domain.audit.WorktreeInfo;
import java.util.Objects;

/**
 * Worktree left out of an aggregate because its log could not be used.
 *
 * @param worktree excluded worktree
 * @param reason human-readable cause
 * @since 0.1.0
 */
public record ExcludedWorktree(WorktreeInfo worktree, String reason) {
  public ExcludedWorktree {
    Objects.requireNonNull(worktree, "worktree");
    Objects.requireNonNull(reason, "reason");
  }
}
