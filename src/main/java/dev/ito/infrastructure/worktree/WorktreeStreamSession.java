package dev.ito.infrastructure.worktree;

import dev.ito.domain.audit.StreamCursor;
import dev.ito.domain.audit.StreamEvent;
import dev.ito.domain.audit.WorktreeInfo;
import dev.ito.infrastructure.audit.AuditLogStreamWatcher;
import dev.ito.infrastructure.audit.AuditPaths;
import dev.ito.infrastructure.audit.StreamBatch;
import dev.ito.infrastructure.audit.StreamConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-owned tailing state across several worktree logs: one cursor per worktree.
 *
 * <p>Each read merges the new events of all logs by timestamp, then worktree id, then cursor. A log that fails
 * to read is logged and retried on the next poll with its cursor unchanged. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class WorktreeStreamSession {
  private static final Logger log = LoggerFactory.getLogger(WorktreeStreamSession.class);
  private static final Comparator<Tagged> ORDER = Comparator
      .comparing((Tagged t) -> t.event().event().timestamp())
      .thenComparing(t -> t.worktree().id())
      .thenComparing(t -> t.event().cursor());

  private final AuditLogStreamWatcher watcher;
  private final String itoDirName;
  private final Map<WorktreeInfo, StreamCursor> cursors = new LinkedHashMap<>();
  private long skippedLines;

  public WorktreeStreamSession(
      AuditLogStreamWatcher watcher, List<WorktreeInfo> worktrees, String itoDirName) {
    this.watcher = Objects.requireNonNull(watcher, "watcher");
    this.itoDirName = Objects.requireNonNull(itoDirName, "itoDirName");
    for (WorktreeInfo worktree : Objects.requireNonNull(worktrees, "worktrees")) {
      cursors.put(worktree, StreamCursor.START);
    }
  }

  /**
   * Initial read of every log; {@link StreamConfig#last()} applies to the merged result. A start cursor in
   * {@code config} is ignored because each worktree log needs its own.
   *
   * @param config session settings
   * @return merged initial events
   */
  public List<StreamEvent> readInitial(StreamConfig config) {
    StreamConfig perLog = new StreamConfig(config.pollInterval(), true, 0, Optional.empty());
    List<StreamEvent> merged = collect(
        worktree -> watcher.readInitialEvents(logFile(worktree), perLog, worktree.label()));
    int last = config.last();
    if (last > 0 && merged.size() > last) {
      return List.copyOf(merged.subList(merged.size() - last, merged.size()));
    }
    return merged;
  }

  /**
   * Polls every log once.
   *
   * @return merged new events
   */
  public List<StreamEvent> poll() {
    return collect(
        worktree -> watcher.pollNewEvents(logFile(worktree), cursors.get(worktree), worktree.label()));
  }

  public Map<WorktreeInfo, StreamCursor> cursors() {
    return Map.copyOf(cursors);
  }

  public long skippedLines() {
    return skippedLines;
  }

  private List<StreamEvent> collect(BatchReader reader) {
    List<Tagged> tagged = new ArrayList<>();
    for (WorktreeInfo worktree : cursors.keySet()) {
      try {
        StreamBatch batch = reader.read(worktree);
        cursors.put(worktree, batch.cursor());
        skippedLines += batch.issues().size();
        for (StreamEvent event : batch.events()) {
          tagged.add(new Tagged(worktree, event));
        }
      } catch (IOException ex) {
        log.warn("Unable to read audit log of worktree {}: {}", worktree.id(), ex.getMessage());
      }
    }
    tagged.sort(ORDER);
    return tagged.stream().map(Tagged::event).toList();
  }

  private Path logFile(WorktreeInfo worktree) {
    return AuditPaths.logFileForWorktree(worktree.path(), itoDirName);
  }

  @FunctionalInterface
  private interface BatchReader {
    StreamBatch read(WorktreeInfo worktree) throws IOException;
  }

  private record Tagged(WorktreeInfo worktree, StreamEvent event) {}
}
