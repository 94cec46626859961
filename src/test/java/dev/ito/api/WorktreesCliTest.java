package dev.ito.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ito.domain.audit.WorktreeInfo;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorktreesCliTest {
  @TempDir Path project;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() {
    cli = new CliTestSupport();
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.reset();
  }

  @Test
  void outsideGitListsProjectRoot() {
    assertEquals(ExitCode.SUCCESS, WorktreesCli.run(new String[] {CliTestSupport.root(project)}));

    List<String> lines = cli.stdout().lines().toList();
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).startsWith("* (detached)"));
    assertTrue(lines.get(0).endsWith("(missing)"));
  }

  @Test
  void textMarksMainWorktreeAndExistingLogs() throws Exception {
    Path main = Files.createDirectories(project.resolve("main"));
    Path feature = Files.createDirectories(project.resolve("feature"));
    Files.createDirectories(CliTestSupport.logFile(main).getParent());
    Files.writeString(CliTestSupport.logFile(main), "");

    List<String> lines = WorktreesCli.toText(List.of(
        new WorktreeInfo(main, "main", true),
        new WorktreeInfo(feature, "feature/login", false)), ".ito");

    assertTrue(lines.get(0).startsWith("* main"));
    assertFalse(lines.get(0).endsWith("(missing)"));
    assertTrue(lines.get(1).startsWith("  feature/login"));
    assertTrue(lines.get(1).endsWith("(missing)"));
  }

  @Test
  void jsonListsEveryWorktree() {
    String json = WorktreesCli.toJson(List.of(new WorktreeInfo(project, null, true)), ".ito");

    assertTrue(json.startsWith("[{\"path\":"));
    assertTrue(json.contains("\"branch\":null"));
    assertTrue(json.contains("\"logExists\":false"));
  }
}
