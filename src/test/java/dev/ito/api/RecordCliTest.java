package dev.ito.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.infrastructure.audit.AuditLogReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RecordCliTest {
  @TempDir Path project;

  private CliTestSupport cli;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() throws Exception {
    Files.createDirectories(project.resolve(".ito"));
    cli = new CliTestSupport();
    logger = (Logger) LoggerFactory.getLogger(RecordCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliTestSupport.reset();
  }

  @Test
  void appendsEventWithDefaults() throws Exception {
    ExitCode code = RecordCli.run(new String[] {
        "entity=task", "id=1.1", "scope=add-login", "op=status_change", "from=pending", "to=complete",
        "meta={\"note\":\"a=b\"}", CliTestSupport.root(project)});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(cli.stdout().startsWith("Recorded 2026-03-01T12:00:00.000Z  task/1.1 (scope: add-login)"));
    List<AuditEvent> events = new AuditLogReader().readAll(CliTestSupport.logFile(project)).events();
    assertEquals(1, events.size());
    AuditEvent event = events.get(0);
    assertEquals("cli", event.actor());
    assertEquals("@jane-doe", event.by());
    assertEquals(Map.of("note", "a=b"), event.meta());
    assertEquals(1, cli.metrics().count("audit.append.success"));
  }

  @Test
  void jsonFlagPrintsEncodedRecord() {
    ExitCode code = RecordCli.run(new String[] {
        "entity=change", "id=add-login", "op=archive", "actor=ralph", "by=@loop", "--json",
        CliTestSupport.root(project)});

    assertEquals(ExitCode.SUCCESS, code);
    String line = cli.stdout().strip();
    assertTrue(line.startsWith("{\"v\":1,"));
    assertTrue(line.contains("\"op\":\"archive\""));
    assertTrue(line.contains("\"by\":\"@loop\""));
  }

  @Test
  void missingRequiredFieldsReturnInvalidArgs() {
    ExitCode code = RecordCli.run(new String[] {"entity=task", "id=1.1", CliTestSupport.root(project)});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(cli.stdout().contains("usage: record"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("requires entity=")));
    assertFalse(Files.exists(CliTestSupport.logFile(project)));
  }

  @Test
  void malformedMetaReturnsInvalidArgs() {
    ExitCode code = RecordCli.run(new String[] {
        "entity=task", "id=1.1", "op=note", "meta={broken", CliTestSupport.root(project)});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void uninitialisedProjectWarnsAndDiscards(@TempDir Path bare) {
    ExitCode code = RecordCli.run(new String[] {
        "entity=task", "id=1.1", "op=create", "to=pending", CliTestSupport.root(bare)});

    assertEquals(ExitCode.SUCCESS, code);
    assertFalse(Files.exists(CliTestSupport.logFile(bare)));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("not persisted")));
  }
}
