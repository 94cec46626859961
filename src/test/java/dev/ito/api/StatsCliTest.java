package dev.ito.api;

import static dev.ito.domain.audit.AuditEventFixtures.created;
import static dev.ito.domain.audit.AuditEventFixtures.status;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatsCliTest {
  @TempDir Path project;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() throws Exception {
    cli = new CliTestSupport();
    CliTestSupport.seed(project,
        created("1.1", "a", 0),
        status("1.1", "a", "pending", "complete", 1),
        created("1.1", "b", 2));
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.reset();
  }

  @Test
  void textGroupsCounts() {
    assertEquals(ExitCode.SUCCESS, StatsCli.run(new String[] {CliTestSupport.root(project)}));

    List<String> lines = cli.stdout().lines().toList();
    assertEquals("Total events: 3", lines.get(0));
    assertTrue(lines.contains("By scope:"));
  }

  @Test
  void changeRestrictsToScope() {
    StatsCli.run(new String[] {"change=b", "--json", CliTestSupport.root(project)});

    String json = cli.stdout().strip();
    assertTrue(json.startsWith("{\"total\":1,"));
    assertTrue(json.contains("\"byScope\":{\"b\":1}"));
  }
}
