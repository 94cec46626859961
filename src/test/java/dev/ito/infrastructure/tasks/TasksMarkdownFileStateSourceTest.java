package dev.ito.infrastructure.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ito.domain.audit.EntityKey;
import dev.ito.domain.audit.EntityTypes;
import dev.ito.domain.audit.FileState;
import dev.ito.domain.audit.ReconcileInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TasksMarkdownFileStateSourceTest {
  @TempDir Path itoDir;

  private final TasksMarkdownFileStateSource source = new TasksMarkdownFileStateSource();

  private void writeTasks(String change, String contents) throws Exception {
    Path dir = Files.createDirectories(itoDir.resolve("changes").resolve(change));
    Files.writeString(dir.resolve("tasks.md"), contents);
  }

  @Test
  void parsesEnhancedLayout() {
    String contents = """
        # Tasks

        ## Wave 1

        ### Task 1.1: Add login form
        - **Files**: `src/login.ts`
        - **Status**: [x] complete

        ### Task 1.2: Wire session
        - **Status**: [ ] pending

        ### Checkpoint: review
        - **Status**: [ ] pending

        ### Task 2.1: Docs
        - **Status**: [-] shelved
        """;

    assertEquals(List.of(
        new TasksMarkdownFileStateSource.TaskStatusLine("1.1", "complete"),
        new TasksMarkdownFileStateSource.TaskStatusLine("1.2", "pending"),
        new TasksMarkdownFileStateSource.TaskStatusLine("2.1", "shelved")),
        TasksMarkdownFileStateSource.parse(contents));
  }

  @Test
  void parsesCheckboxLayout() {
    String contents = """
        ## Tasks
        - [x] 1.1 Create schema
        - [~] 1.2 Migrate data
        - [ ] 1.3 Remove old table
        - [ ] Follow-up without id
        """;

    List<TasksMarkdownFileStateSource.TaskStatusLine> tasks = TasksMarkdownFileStateSource.parse(contents);

    assertEquals(4, tasks.size());
    assertEquals("complete", tasks.get(0).status());
    assertEquals("in-progress", tasks.get(1).status());
    assertEquals("1.3", tasks.get(2).id());
    assertEquals("4", tasks.get(3).id());
  }

  @Test
  void singleChangeIsScopedByChangeId() throws Exception {
    writeTasks("add-login", "- [x] 1.1 Form\n- [ ] 1.2 Session\n");
    writeTasks("other", "- [ ] 9.1 Unrelated\n");

    FileState state = source.load(itoDir, Optional.of("add-login"));

    assertEquals(2, state.size());
    assertEquals(Optional.of("complete"),
        state.valueOf(new EntityKey(EntityTypes.TASK, "1.1", "add-login")));
  }

  @Test
  void projectWideSkipsArchive() throws Exception {
    writeTasks("a", "- [x] 1.1 One\n");
    writeTasks("b", "- [ ] 1.1 One\n");
    writeTasks("archive", "- [x] 7.7 Old\n");

    FileState state = source.load(itoDir, Optional.empty());

    assertEquals(2, state.size());
    assertEquals(Optional.of("pending"), state.valueOf(new EntityKey(EntityTypes.TASK, "1.1", "b")));
  }

  @Test
  void projectWideRecordsEveryScannedChange() throws Exception {
    writeTasks("a", "- [x] 1.1 One\n");
    writeTasks("emptied", "# Tasks\n");
    Files.createDirectories(itoDir.resolve("changes").resolve("no-tasks-file"));
    writeTasks("archive", "- [x] 7.7 Old\n");

    FileState state = source.load(itoDir, Optional.empty());

    assertEquals(1, state.size());
    assertEquals(Set.of("a", "emptied", "no-tasks-file"), state.scopes());
  }

  @Test
  void projectWithoutChangesIsEmpty() throws Exception {
    assertTrue(source.load(itoDir, Optional.empty()).isEmpty());
  }

  @Test
  void unknownOrUnsafeChangeIsRejected() {
    assertThrows(ReconcileInputException.class, () -> source.load(itoDir, Optional.of("missing")));
    assertThrows(ReconcileInputException.class, () -> source.load(itoDir, Optional.of("../etc")));
  }
}
