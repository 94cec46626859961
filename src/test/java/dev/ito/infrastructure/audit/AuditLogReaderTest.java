package dev.ito.infrastructure.audit;

import static dev.ito.domain.audit.AuditEventFixtures.created;
import static dev.ito.domain.audit.AuditEventFixtures.status;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ito.application.port.RecordingMetricsPort;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.LineIssue;
import dev.ito.domain.audit.ReadResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuditLogReaderTest {
  @TempDir Path dir;

  private final AuditEventCodec codec = new AuditEventCodec();

  private Path writeLines(String... lines) throws Exception {
    Path logFile = dir.resolve("events.jsonl");
    Files.writeString(logFile, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    return logFile;
  }

  @Test
  void missingLogReadsAsEmpty() throws Exception {
    ReadResult result = new AuditLogReader().readAll(dir.resolve("absent.jsonl"));

    assertTrue(result.events().isEmpty());
    assertFalse(result.hasIssues());
  }

  @Test
  void truncatedTrailingLineIsReportedAndEarlierEventsSurvive() throws Exception {
    AuditEvent first = created("1.1", "c", 0);
    AuditEvent second = status("1.1", "c", "pending", "complete", 1);
    Path logFile = writeLines(codec.encode(first), codec.encode(second));
    String partial = codec.encode(created("1.2", "c", 2));
    Files.writeString(logFile, partial.substring(0, 40), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ReadResult result = new AuditLogReader(codec, metrics).readAll(logFile);

    assertEquals(List.of(first, second), result.events());
    assertEquals(1, result.skippedLines());
    assertEquals(3, result.issues().get(0).lineNumber());
    assertEquals(1, metrics.count("audit.read.skipped"));
  }

  @Test
  void trailingWriteCutInsideMultiByteCharacterIsReportedAsMalformed() throws Exception {
    AuditEvent first = created("1.1", "c", 0);
    Path logFile = writeLines(codec.encode(first));
    byte[] cut = "{\"v\":1,\"note\":\"caf\u00e9".getBytes(StandardCharsets.UTF_8);
    Files.write(logFile, Arrays.copyOf(cut, cut.length - 1), StandardOpenOption.APPEND);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ReadResult result = new AuditLogReader(codec, metrics).readAll(logFile);

    assertEquals(List.of(first), result.events());
    assertEquals(1, result.issues().size());
    assertEquals(LineIssue.Kind.MALFORMED, result.issues().get(0).kind());
    assertEquals(2, result.issues().get(0).lineNumber());
    assertEquals(1, metrics.count("audit.read.skipped"));
  }

  @Test
  void invalidUtf8LineDoesNotHideLaterEvents() throws Exception {
    AuditEvent first = created("1.1", "c", 0);
    AuditEvent last = created("1.2", "c", 1);
    Path logFile = dir.resolve("events.jsonl");
    Files.write(logFile, (codec.encode(first) + "\n").getBytes(StandardCharsets.UTF_8));
    Files.write(logFile, new byte[] {'{', (byte) 0xC3, (byte) 0x28, '}', '\n'}, StandardOpenOption.APPEND);
    Files.write(logFile, (codec.encode(last) + "\n").getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);

    ReadResult result = new AuditLogReader().readAll(logFile);

    assertEquals(List.of(first, last), result.events());
    assertEquals(1, result.issues().size());
    assertEquals(LineIssue.Kind.MALFORMED, result.issues().get(0).kind());
  }

  @Test
  void corruptLineInTheMiddleIsSkipped() throws Exception {
    Path logFile = writeLines(
        codec.encode(created("1.1", "c", 0)),
        "not json at all",
        "",
        codec.encode(created("1.2", "c", 1)));

    ReadResult result = new AuditLogReader().readAll(logFile);

    assertEquals(2, result.events().size());
    assertEquals(1, result.issues().size());
    assertEquals(LineIssue.Kind.MALFORMED, result.issues().get(0).kind());
  }

  @Test
  void unsupportedSchemaVersionIsCountedSeparately() throws Exception {
    String future = codec.encode(created("1.2", "c", 1)).replaceFirst("\"v\":1", "\"v\":7");
    Path logFile = writeLines(codec.encode(created("1.1", "c", 0)), future);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ReadResult result = new AuditLogReader(codec, metrics).readAll(logFile);

    assertEquals(1, result.events().size());
    assertEquals(0, result.skippedLines());
    assertEquals(1, result.unsupportedVersionLines());
    assertEquals(1, metrics.count("audit.read.unsupportedVersion"));
  }

  @Test
  void filterKeepsFileOrder() throws Exception {
    Path logFile = writeLines(
        codec.encode(created("1.1", "a", 0)),
        codec.encode(created("1.1", "b", 1)),
        codec.encode(status("1.1", "a", "pending", "complete", 2)));

    ReadResult result = new AuditLogReader().readFiltered(logFile, EventFilter.builder().scope("a").build());

    assertEquals(2, result.events().size());
    assertEquals("create", result.events().get(0).op());
    assertEquals("status_change", result.events().get(1).op());
  }
}
