package dev.ito.api;

import static dev.ito.domain.audit.AuditEventFixtures.created;
import static dev.ito.domain.audit.AuditEventFixtures.status;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidateCliTest {
  @TempDir Path project;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() throws Exception {
    cli = new CliTestSupport();
    CliTestSupport.seed(project,
        created("1.1", "c", 0),
        status("1.1", "c", "in-progress", "complete", 1));
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.reset();
  }

  @Test
  void warningsKeepLogValid() {
    ExitCode code = ValidateCli.run(new String[] {CliTestSupport.root(project)});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(cli.stdout().startsWith("Validated 2 event(s): valid"));
    assertTrue(cli.stdout().contains("WARNING [event 1]"));
  }

  @Test
  void corruptLineMakesLogInvalid() throws Exception {
    Files.writeString(CliTestSupport.logFile(project), "{\"v\":1,\n", StandardOpenOption.APPEND);

    ExitCode code = ValidateCli.run(new String[] {"--json", CliTestSupport.root(project)});

    assertEquals(ExitCode.DRIFT_DETECTED, code);
    assertTrue(cli.stdout().contains("\"valid\":false"));
    assertTrue(cli.stdout().contains("\"level\":\"error\""));
  }

  @Test
  void missingLogIsEmptyAndValid(@TempDir Path bare) {
    assertEquals(ExitCode.SUCCESS, ValidateCli.run(new String[] {CliTestSupport.root(bare)}));
    assertTrue(cli.stdout().startsWith("Validated 0 event(s): valid"));
  }
}
