package dev.ito.infrastructure.worktree;

import dev.ito.domain.audit.WorktreeInfo;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code git worktree list --porcelain} output.
 *
 * <p>Blocks are separated by blank lines and start with {@code worktree <path>}; {@code branch refs/heads/x}
 * names the branch, {@code detached} and {@code bare} flag the entry. Bare entries are dropped and the first
 * remaining entry is the main worktree.</p>
 *
 * @since 0.1.0
 */
public final class WorktreePorcelainParser {
  private static final String WORKTREE = "worktree ";
  private static final String BRANCH = "branch ";
  private static final String HEADS = "refs/heads/";

  private WorktreePorcelainParser() {
    // Utility
  }

  public static List<WorktreeInfo> parse(String porcelain) {
    List<WorktreeInfo> result = new ArrayList<>();
    if (porcelain == null || porcelain.isBlank()) {
      return result;
    }
    Block block = null;
    for (String raw : porcelain.split("\\R", -1)) {
      String line = raw.strip();
      if (line.isEmpty()) {
        flush(block, result);
        block = null;
        continue;
      }
      if (line.startsWith(WORKTREE)) {
        flush(block, result);
        block = new Block(line.substring(WORKTREE.length()).strip());
      } else if (block == null) {
        continue;
      } else if (line.startsWith(BRANCH)) {
        String ref = line.substring(BRANCH.length()).strip();
        block.branch = ref.startsWith(HEADS) ? ref.substring(HEADS.length()) : ref;
      } else if (line.equals("bare")) {
        block.bare = true;
      } else if (line.equals("detached")) {
        block.branch = null;
      }
    }
    flush(block, result);
    return result;
  }

  private static void flush(Block block, List<WorktreeInfo> result) {
    if (block == null || block.bare || block.path.isEmpty()) {
      return;
    }
    result.add(new WorktreeInfo(Path.of(block.path), block.branch, result.isEmpty()));
  }

  private static final class Block {
    private final String path;
    private String branch;
    private boolean bare;

    private Block(String path) {
      this.path = path;
    }
  }
}
