package dev.ito.api;

import static dev.ito.domain.audit.AuditEventFixtures.created;
import static dev.ito.domain.audit.AuditEventFixtures.status;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ito.domain.audit.AuditEvent;
import dev.ito.infrastructure.audit.AuditLogReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReconcileCliTest {
  @TempDir Path project;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() throws Exception {
    cli = new CliTestSupport();
    Path change = Files.createDirectories(project.resolve(".ito/changes/add-login"));
    Files.writeString(change.resolve("tasks.md"), """
        ## Tasks
        - [x] 1.1 Login form
        - [ ] 1.2 Session cookie
        """);
    CliTestSupport.seed(project,
        created("1.1", "add-login", 0),
        status("1.1", "add-login", "pending", "in-progress", 1),
        created("1.2", "add-login", 2));
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.reset();
  }

  @Test
  void driftWithoutFixExitsWithDriftDetected() {
    ExitCode code = ReconcileCli.run(new String[] {"change=add-login", CliTestSupport.root(project)});

    assertEquals(ExitCode.DRIFT_DETECTED, code);
    String out = cli.stdout();
    assertTrue(out.contains("Diverged: task/1.1 (scope: add-login)"));
    assertTrue(out.contains("1 drift(s): 1 diverged, 0 unlogged, 0 orphaned"));
    assertTrue(out.contains("Run with --fix"));
  }

  @Test
  void fixWritesCompensatingEventAndSecondRunIsClean() throws Exception {
    ExitCode fixed = ReconcileCli.run(
        new String[] {"change=add-login", "--fix", CliTestSupport.root(project)});

    assertEquals(ExitCode.SUCCESS, fixed);
    assertTrue(cli.stdout().contains("Wrote 1 compensating event(s)."));
    List<AuditEvent> events = new AuditLogReader().readAll(CliTestSupport.logFile(project)).events();
    AuditEvent compensation = events.get(events.size() - 1);
    assertEquals("reconciled", compensation.op());
    assertEquals("in-progress", compensation.from());
    assertEquals("complete", compensation.to());
    assertEquals("@reconcile", compensation.by());

    assertEquals(ExitCode.SUCCESS,
        ReconcileCli.run(new String[] {"change=add-login", CliTestSupport.root(project)}));
    assertTrue(cli.stdout().contains("No drift detected."));
  }

  @Test
  void jsonReportListsDrifts() {
    ReconcileCli.run(new String[] {"--json", CliTestSupport.root(project)});

    String json = cli.stdout().strip();
    assertTrue(json.startsWith("{\"scope\":\"project\""));
    assertTrue(json.contains("\"clean\":false"));
    assertTrue(json.contains("\"kind\":\"diverged\""));
  }

  @Test
  void projectWideReportsTasksRemovedFromLiveChange() throws Exception {
    Path emptied = Files.createDirectories(project.resolve(".ito/changes/emptied"));
    Files.writeString(emptied.resolve("tasks.md"), "## Tasks\n");
    CliTestSupport.seed(project, status("1.1", "emptied", "pending", "complete", 3));

    ExitCode code = ReconcileCli.run(new String[] {CliTestSupport.root(project)});

    assertEquals(ExitCode.DRIFT_DETECTED, code);
    String out = cli.stdout();
    assertTrue(out.contains("2 drift(s): 1 diverged, 0 unlogged, 1 orphaned"));
  }

  @Test
  void unknownChangeIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR,
        ReconcileCli.run(new String[] {"change=missing", CliTestSupport.root(project)}));
  }
}
