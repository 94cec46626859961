package dev.ito.infrastructure.tasks;

import dev.ito.application.port.FileStateSource;
import dev.ito.domain.audit.EntityTypes;
import dev.ito.domain.audit.FileState;
import dev.ito.domain.audit.ReconcileInputException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives task statuses from {@code <ito>/changes/<change>/tasks.md}.
 *
 * <p>Two layouts are recognised. The enhanced layout uses {@code ### Task 1.1: Name} headings followed by a
 * {@code - **Status**: [x] complete} line. The checkbox layout uses {@code - [x] 1.1 Name} items, where
 * {@code x} means complete, a blank means pending and {@code ~} or {@code >} means in progress. Every task
 * becomes the key {@code (task, <id>, <change>)}.</p>
 *
 * @since 0.1.0
 */
public final class TasksMarkdownFileStateSource implements FileStateSource {
  private static final Logger log = LoggerFactory.getLogger(TasksMarkdownFileStateSource.class);
  static final String CHANGES_DIR = "changes";
  static final String ARCHIVE_DIR = "archive";
  static final String TASKS_FILE = "tasks.md";

  private static final Pattern SAFE_CHANGE_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");
  private static final Pattern TASK_HEADING = Pattern.compile("^###\\s+(?:Task\\s+)?([^:]+):\\s+(.+?)\\s*$");
  private static final Pattern STATUS_LINE = Pattern.compile(
      "\\*\\*Status\\*\\*:\\s*\\[([ xX\\-~])\\]\\s+(pending|in-progress|complete|shelved)\\s*$");
  private static final Pattern CHECKBOX = Pattern.compile("^[-*]\\s\\[([ xX~>])\\]\\s?(.*)$");
  private static final Pattern CHECKBOX_ID = Pattern.compile("^(\\d+(?:\\.\\d+)*)[.:]?$");

  @Override
  public FileState load(Path itoDir, Optional<String> changeId) throws ReconcileInputException {
    Objects.requireNonNull(itoDir, "itoDir");
    Objects.requireNonNull(changeId, "changeId");
    FileState.Builder state = FileState.builder();
    if (changeId.isPresent()) {
      String change = requireSafe(changeId.get());
      Path dir = itoDir.resolve(CHANGES_DIR).resolve(change);
      if (!Files.isDirectory(dir)) {
        throw new ReconcileInputException("Change not found: " + change);
      }
      loadChange(dir, change, state);
      return state.build();
    }

    Path changes = itoDir.resolve(CHANGES_DIR);
    if (!Files.isDirectory(changes)) {
      return state.build();
    }
    for (Path dir : listChangeDirs(changes)) {
      loadChange(dir, dir.getFileName().toString(), state);
    }
    return state.build();
  }

  /**
   * Parses one tasks document into {@code (id, status)} pairs.
   *
   * @param contents tasks.md text
   * @return tasks in document order
   */
  static List<TaskStatusLine> parse(String contents) {
    boolean enhanced = contents.contains("- **Status**:")
        && contents.lines().anyMatch(line -> TASK_HEADING.matcher(line).matches());
    return enhanced ? parseEnhanced(contents) : parseCheckbox(contents);
  }

  private static void loadChange(Path dir, String change, FileState.Builder state)
      throws ReconcileInputException {
    state.scanned(change);
    Path tasks = dir.resolve(TASKS_FILE);
    if (!Files.exists(tasks)) {
      log.debug("No {} for change {}", TASKS_FILE, change);
      return;
    }
    String contents;
    try {
      contents = Files.readString(tasks, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new ReconcileInputException("Unable to read " + tasks, ex);
    }
    for (TaskStatusLine task : parse(contents)) {
      state.put(EntityTypes.TASK, task.id(), change, task.status());
    }
  }

  private static List<Path> listChangeDirs(Path changes) throws ReconcileInputException {
    try (Stream<Path> entries = Files.list(changes)) {
      return entries
          .filter(Files::isDirectory)
          .filter(dir -> !ARCHIVE_DIR.equals(dir.getFileName().toString()))
          .sorted()
          .toList();
    } catch (IOException ex) {
      throw new ReconcileInputException("Unable to list " + changes, ex);
    }
  }

  private static List<TaskStatusLine> parseEnhanced(String contents) {
    List<TaskStatusLine> tasks = new ArrayList<>();
    String currentId = null;
    for (String line : contents.lines().toList()) {
      String trimmed = line.strip();
      Matcher heading = TASK_HEADING.matcher(trimmed);
      if (heading.matches()) {
        String id = heading.group(1).strip();
        currentId = id.startsWith("Checkpoint") ? null : id;
        continue;
      }
      if (trimmed.startsWith("#")) {
        currentId = null;
        continue;
      }
      if (currentId == null) {
        continue;
      }
      Matcher status = STATUS_LINE.matcher(trimmed);
      if (status.find()) {
        tasks.add(new TaskStatusLine(currentId, status.group(2)));
        currentId = null;
      }
    }
    return tasks;
  }

  private static List<TaskStatusLine> parseCheckbox(String contents) {
    List<TaskStatusLine> tasks = new ArrayList<>();
    for (String line : contents.lines().toList()) {
      Matcher item = CHECKBOX.matcher(line.stripLeading());
      if (!item.matches()) {
        continue;
      }
      String status = switch (item.group(1)) {
        case "x", "X" -> "complete";
        case "~", ">" -> "in-progress";
        default -> "pending";
      };
      String label = item.group(2).strip();
      String firstToken = label.isEmpty() ? "" : label.split("\\s+", 2)[0];
      Matcher id = CHECKBOX_ID.matcher(firstToken);
      tasks.add(new TaskStatusLine(id.matches() ? id.group(1) : Integer.toString(tasks.size() + 1), status));
    }
    return tasks;
  }

  private static String requireSafe(String changeId) throws ReconcileInputException {
    String trimmed = changeId.strip();
    if (!SAFE_CHANGE_ID.matcher(trimmed).matches() || trimmed.contains("..")) {
      throw new ReconcileInputException("Invalid change id: " + changeId);
    }
    return trimmed;
  }

  record TaskStatusLine(String id, String status) {}
}
