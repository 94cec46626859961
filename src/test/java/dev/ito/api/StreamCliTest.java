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

class StreamCliTest {
  @TempDir Path project;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() throws Exception {
    cli = new CliTestSupport();
    CliTestSupport.seed(project,
        created("1.1", "c", 0),
        created("1.2", "c", 1),
        created("1.3", "c", 2));
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.reset();
  }

  private String[] args(String... extra) {
    String[] all = new String[extra.length + 3];
    all[0] = "maxPolls=1";
    all[1] = "interval=10";
    all[2] = CliTestSupport.root(project);
    System.arraycopy(extra, 0, all, 3, extra.length);
    return all;
  }

  @Test
  void showsNewestEventsThenCursor() {
    ExitCode code = StreamCli.run(args("last=2"));

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = cli.stdout().lines().toList();
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).contains("task/1.2"));
    assertTrue(lines.get(1).contains("task/1.3"));
    assertTrue(lines.get(2).startsWith("cursor=c1."));
  }

  @Test
  void resumingFromCursorDeliversOnlyLaterEvents() throws Exception {
    StreamCli.run(args());
    List<String> first = cli.stdout().lines().toList();
    String cursorLine = first.get(first.size() - 1);

    CliTestSupport.seed(project, status("1.1", "c", "pending", "complete", 3));
    CliTestSupport.reset();
    cli = new CliTestSupport();
    StreamCli.run(args(cursorLine));

    List<String> resumed = cli.stdout().lines().toList();
    assertEquals(2, resumed.size());
    assertTrue(resumed.get(0).contains("status_change pending -> complete"));
  }

  @Test
  void jsonWrapsEventWithCursor() {
    StreamCli.run(args("last=1", "--json"));

    String first = cli.stdout().lines().findFirst().orElseThrow();
    assertTrue(first.startsWith("{\"cursor\":\"c1."));
    assertTrue(first.contains("\"event\":{\"v\":1,"));
  }

  @Test
  void invalidCursorIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, StreamCli.run(args("cursor=bogus")));
  }

  @Test
  void intervalOutOfRangeIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS,
        StreamCli.run(new String[] {"interval=1", "maxPolls=1", CliTestSupport.root(project)}));
  }
}
