package dev.ito.infrastructure.worktree;

import dev.ito.application.port.GitPort;
import dev.ito.domain.audit.WorktreeInfo;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds every working tree that shares the project repository.
 *
 * <p>When git is missing, fails, or reports nothing usable, the project root alone is returned as the main
 * worktree so single-tree projects keep working.</p>
 *
 * @since 0.1.0
 */
public final class GitWorktreeDiscovery {
  private static final Logger log = LoggerFactory.getLogger(GitWorktreeDiscovery.class);
  private static final List<String> LIST_COMMAND = List.of("worktree", "list", "--porcelain");

  private final GitPort git;

  public GitWorktreeDiscovery(GitPort git) {
    this.git = Objects.requireNonNull(git, "git");
  }

  /**
   * Discovers worktrees for {@code projectRoot}.
   *
   * @param projectRoot any directory inside the project
   * @return worktrees with the main worktree first; never empty
   */
  public List<WorktreeInfo> discoverWorktrees(Path projectRoot) {
    Path root = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
    try {
      GitPort.Result result = git.run(root, LIST_COMMAND);
      if (!result.succeeded()) {
        log.warn("git worktree list failed in {} (exit {}): {}; using project root only",
            root, result.exitCode(), result.stderr().strip());
        return fallback(root);
      }
      List<WorktreeInfo> worktrees = WorktreePorcelainParser.parse(result.stdout());
      if (worktrees.isEmpty()) {
        log.warn("git reported no usable worktrees for {}; using project root only", root);
        return fallback(root);
      }
      log.debug("Discovered {} worktree(s) for {}", worktrees.size(), root);
      return List.copyOf(worktrees);
    } catch (IOException ex) {
      log.warn("Unable to run git in {}: {}; using project root only", root, ex.getMessage());
      return fallback(root);
    }
  }

  /**
   * Finds the worktree that has {@code branch} checked out.
   *
   * @param worktrees discovered worktrees
   * @param branch branch name without {@code refs/heads/}
   * @return matching worktree, if any
   */
  public static Optional<WorktreeInfo> findWorktreeForBranch(List<WorktreeInfo> worktrees, String branch) {
    Objects.requireNonNull(worktrees, "worktrees");
    if (branch == null || branch.isBlank()) {
      return Optional.empty();
    }
    return worktrees.stream().filter(wt -> branch.equals(wt.branch())).findFirst();
  }

  private static List<WorktreeInfo> fallback(Path root) {
    return List.of(new WorktreeInfo(root, null, true));
  }
}
