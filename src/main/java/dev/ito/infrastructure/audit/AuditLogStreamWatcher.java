package dev.ito.infrastructure.audit;

import dev.ito.application.port.MetricsPort;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.AuditRecordException;
import dev.ito.domain.audit.LineIssue;
import dev.ito.domain.audit.StreamCursor;
import dev.ito.domain.audit.StreamEvent;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incrementally tails an audit log using opaque {@link StreamCursor}s.
 *
 * <p><strong>Delivery:</strong> An event is returned by exactly one call for a given cursor lineage: every call
 * starts after the supplied cursor and returns a cursor positioned after the last consumed line.</p>
 * <p><strong>Partial writes:</strong> Only newline-terminated lines are consumed; a trailing fragment stays
 * unread until its newline arrives.</p>
 * <p><strong>Truncation and replacement:</strong> When the file is shorter than the cursor, or its identity
 * changed, the log is re-read from the start and the batch is flagged {@code resynced}.</p>
 * <p><strong>Threading:</strong> No background work; callers poll on their own schedule. Stateless between
 * calls, so one instance may serve several logs.</p>
 *
 * @since 0.1.0
 */
public final class AuditLogStreamWatcher {
  private static final Logger log = LoggerFactory.getLogger(AuditLogStreamWatcher.class);
  private static final int READ_CHUNK = 8192;

  private final AuditEventCodec codec;
  private final MetricsPort metrics;

  public AuditLogStreamWatcher() {
    this(new AuditEventCodec(), MetricsPort.NO_OP);
  }

  public AuditLogStreamWatcher(AuditEventCodec codec, MetricsPort metrics) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads the whole log and returns every event plus the end-of-file cursor.
   *
   * @param logFile log path; a missing file yields no events
   * @return initial batch
   * @throws IOException when the log exists but cannot be read
   */
  public StreamBatch readInitialEvents(Path logFile) throws IOException {
    return read(logFile, StreamCursor.START, sourceOf(logFile), false);
  }

  /**
   * Starts a session from {@code config}: resumes at its start cursor when present, otherwise reads the whole
   * log and keeps only the newest {@link StreamConfig#last()} events.
   *
   * @param logFile log path
   * @param config session settings
   * @param source label stamped on each event
   * @return initial batch; its cursor always covers every consumed line
   * @throws IOException when the log exists but cannot be read
   */
  public StreamBatch readInitialEvents(Path logFile, StreamConfig config, String source) throws IOException {
    Objects.requireNonNull(config, "config");
    if (config.startCursor().isPresent()) {
      return read(logFile, config.startCursor().get(), source, true);
    }
    StreamBatch batch = read(logFile, StreamCursor.START, source, false);
    int last = config.last();
    if (last == 0 || batch.events().size() <= last) {
      return batch;
    }
    List<StreamEvent> tail = batch.events().subList(batch.events().size() - last, batch.events().size());
    return new StreamBatch(tail, batch.cursor(), batch.issues(), batch.resynced());
  }

  /**
   * Returns the events appended after {@code cursor}.
   *
   * @param logFile log path
   * @param cursor cursor returned by the previous call
   * @return new events and the advanced cursor
   * @throws IOException when the log exists but cannot be read
   */
  public StreamBatch pollNewEvents(Path logFile, StreamCursor cursor) throws IOException {
    return pollNewEvents(logFile, cursor, sourceOf(logFile));
  }

  /**
   * Variant of {@link #pollNewEvents(Path, StreamCursor)} with an explicit source label.
   *
   * @param logFile log path
   * @param cursor cursor returned by the previous call
   * @param source label stamped on each event
   * @return new events and the advanced cursor
   * @throws IOException when the log exists but cannot be read
   */
  public StreamBatch pollNewEvents(Path logFile, StreamCursor cursor, String source) throws IOException {
    return read(logFile, Objects.requireNonNull(cursor, "cursor"), source, true);
  }

  private StreamBatch read(Path logFile, StreamCursor from, String source, boolean checkStale)
      throws IOException {
    Objects.requireNonNull(logFile, "logFile");
    Objects.requireNonNull(source, "source");
    BasicFileAttributes attributes;
    try {
      attributes = Files.readAttributes(logFile, BasicFileAttributes.class);
    } catch (NoSuchFileException ex) {
      boolean lost = checkStale && from.byteOffset() > 0;
      if (lost) {
        resynced(logFile, "log file no longer exists");
      }
      return new StreamBatch(List.of(), StreamCursor.START, List.of(), lost);
    }

    String identity = identityOf(attributes);
    StreamCursor start = from;
    boolean resynced = false;
    if (checkStale && isStale(from, attributes.size(), identity)) {
      resynced(logFile, "log shrank or was replaced below cursor " + from.token());
      start = StreamCursor.START;
      resynced = true;
    }

    byte[] bytes = readFrom(logFile, start.byteOffset());
    List<StreamEvent> events = new ArrayList<>();
    List<LineIssue> issues = new ArrayList<>();
    long offset = start.byteOffset();
    long lines = start.lineCount();
    int lineStart = 0;
    for (int i = 0; i < bytes.length; i++) {
      if (bytes[i] != '\n') {
        continue;
      }
      int lineEnd = i > lineStart && bytes[i - 1] == '\r' ? i - 1 : i;
      int lineFrom = lineStart;
      offset += i + 1 - lineStart;
      lines++;
      lineStart = i + 1;
      StreamCursor position = StreamCursor.of(offset, lines, identity);
      String line = null;
      try {
        line = AuditLogReader.decodeLine(bytes, lineFrom, lineEnd - lineFrom);
        if (line.isBlank()) {
          continue;
        }
        AuditEvent event = codec.decode(line);
        events.add(new StreamEvent(event, position, source));
      } catch (AuditRecordException ex) {
        String shown = line != null ? line : AuditLogReader.lenient(bytes, lineFrom, lineEnd - lineFrom);
        issues.add(AuditLogReader.skip(logFile, lines, shown, ex, metrics));
      }
    }
    if (!events.isEmpty()) {
      metrics.observe("audit.stream.events", events.size());
    }
    return new StreamBatch(events, StreamCursor.of(offset, lines, identity), issues, resynced);
  }

  private void resynced(Object subject, String reason) {
    metrics.increment("audit.stream.resync");
    log.info("Resynchronizing audit stream for {}: {}", subject, reason);
  }

  private static boolean isStale(StreamCursor cursor, long size, String identity) {
    if (cursor.byteOffset() > size) {
      return true;
    }
    return cursor.hasIdentity() && identity != null && !cursor.identity().equals(identity);
  }

  private static byte[] readFrom(Path logFile, long offset) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (SeekableByteChannel channel = Files.newByteChannel(logFile, StandardOpenOption.READ)) {
      channel.position(offset);
      ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
      while (channel.read(buffer) > 0) {
        out.write(buffer.array(), 0, buffer.position());
        buffer.clear();
      }
    }
    return out.toByteArray();
  }

  private static String identityOf(BasicFileAttributes attributes) {
    Object key = attributes.fileKey();
    if (key == null) {
      return null;
    }
    return Integer.toHexString(key.toString().hashCode());
  }

  private static String sourceOf(Path logFile) {
    return logFile.toString();
  }
}
