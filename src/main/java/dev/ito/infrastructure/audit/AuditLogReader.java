package dev.ito.infrastructure.audit;

import dev.ito.application.port.MetricsPort;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.AuditRecordException;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.LineIssue;
import dev.ito.domain.audit.MalformedRecordException;
import dev.ito.domain.audit.ReadResult;
import dev.ito.logging.Logs;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one audit log line by line.
 *
 * <p><strong>Parsing:</strong> Each line is decoded independently as strict UTF-8. Blank lines are ignored. Lines that fail to
 * decode, including a truncated trailing write, are skipped and reported in {@link ReadResult#issues()} with
 * malformed records kept apart from unknown schema versions.</p>
 * <p><strong>Ordering:</strong> Physical file order; no sorting.</p>
 * <p><strong>Missing file:</strong> An empty result. Any other I/O failure propagates.</p>
 * <p><strong>Thread-safety:</strong> Stateless; every call re-reads from disk.</p>
 *
 * @since 0.1.0
 */
public final class AuditLogReader {
  private static final Logger log = LoggerFactory.getLogger(AuditLogReader.class);
  private static final int LOGGED_LINE_BYTES = 160;

  private final AuditEventCodec codec;
  private final MetricsPort metrics;

  public AuditLogReader() {
    this(new AuditEventCodec(), MetricsPort.NO_OP);
  }

  public AuditLogReader(AuditEventCodec codec, MetricsPort metrics) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads every decodable event.
   *
   * @param logFile log path
   * @return events in file order and skipped lines
   * @throws IOException when the file exists but cannot be read
   */
  public ReadResult readAll(Path logFile) throws IOException {
    return readFiltered(logFile, EventFilter.all());
  }

  /**
   * Reads the events accepted by {@code filter}; rejected events are not retained.
   *
   * @param logFile log path
   * @param filter event predicate
   * @return matching events in file order and skipped lines
   * @throws IOException when the file exists but cannot be read
   */
  public ReadResult readFiltered(Path logFile, EventFilter filter) throws IOException {
    Objects.requireNonNull(logFile, "logFile");
    Objects.requireNonNull(filter, "filter");
    if (!Files.exists(logFile)) {
      log.debug("Audit log {} does not exist; nothing to read", logFile);
      return ReadResult.empty();
    }

    byte[] bytes;
    try {
      bytes = Files.readAllBytes(logFile);
    } catch (NoSuchFileException ex) {
      log.debug("Audit log {} disappeared before it could be read", logFile);
      return ReadResult.empty();
    }

    List<AuditEvent> events = new ArrayList<>();
    List<LineIssue> issues = new ArrayList<>();
    long lineNumber = 0;
    int lineStart = 0;
    while (lineStart < bytes.length) {
      int newline = indexOf(bytes, (byte) '\n', lineStart);
      int next = newline < 0 ? bytes.length : newline + 1;
      int lineEnd = newline < 0 ? bytes.length : newline;
      if (lineEnd > lineStart && bytes[lineEnd - 1] == '\r') {
        lineEnd--;
      }
      lineNumber++;
      String line = null;
      try {
        line = decodeLine(bytes, lineStart, lineEnd - lineStart);
        if (!line.isBlank()) {
          AuditEvent event = codec.decode(line);
          if (filter.matches(event)) {
            events.add(event);
          }
        }
      } catch (AuditRecordException ex) {
        String shown = line != null ? line : lenient(bytes, lineStart, lineEnd - lineStart);
        issues.add(skip(logFile, lineNumber, shown, ex, metrics));
      }
      lineStart = next;
    }
    metrics.observe("audit.read.events", events.size());
    if (!issues.isEmpty()) {
      log.warn("Skipped {} unreadable line(s) in {}", issues.size(), logFile);
    }
    return new ReadResult(events, issues);
  }

  /**
   * Decodes one line, rejecting byte sequences that are not valid UTF-8.
   *
   * @param bytes buffer holding the line
   * @param offset first byte of the line
   * @param length line length without its terminator
   * @return decoded text
   * @throws MalformedRecordException when the bytes are not valid UTF-8
   */
  static String decodeLine(byte[] bytes, int offset, int length) throws MalformedRecordException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes, offset, length)).toString();
    } catch (CharacterCodingException ex) {
      throw new MalformedRecordException("line is not valid UTF-8", ex);
    }
  }

  static String lenient(byte[] bytes, int offset, int length) {
    return new String(bytes, offset, length, StandardCharsets.UTF_8);
  }

  private static int indexOf(byte[] bytes, byte target, int from) {
    for (int i = from; i < bytes.length; i++) {
      if (bytes[i] == target) {
        return i;
      }
    }
    return -1;
  }

  static LineIssue skip(
      Path logFile, long lineNumber, String line, AuditRecordException ex, MetricsPort metrics) {
    LineIssue issue = new LineIssue(lineNumber, ex.kind(), ex.getMessage());
    if (issue.kind() == LineIssue.Kind.UNSUPPORTED_SCHEMA_VERSION) {
      metrics.increment("audit.read.unsupportedVersion");
    } else {
      metrics.increment("audit.read.skipped");
    }
    log.debug("Skipping {} line {} of {}: {} [{}]",
        issue.kind(), lineNumber, logFile, ex.getMessage(), Logs.truncate(line, LOGGED_LINE_BYTES));
    return issue;
  }
}
