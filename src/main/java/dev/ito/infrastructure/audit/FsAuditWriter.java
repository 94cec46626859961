package dev.ito.infrastructure.audit;

import dev.ito.application.port.AuditWriter;
import dev.ito.application.port.MetricsPort;
import dev.ito.domain.audit.AuditEvent;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link AuditWriter} that appends JSON lines to a log file.
 *
 * <p><strong>Role:</strong> Default writer adapter once the project state directory exists.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the parent directories on first use.</li>
 *   <li>Open the file in append mode per call and write the full line with its newline in one write.</li>
 *   <li>Force the bytes to storage before returning.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Appends are serialized within the JVM; across processes the OS append
 * semantics keep small lines intact.</p>
 * <p><strong>Failure semantics:</strong> Any I/O failure is rethrown after counting
 * {@code audit.append.failure}; events are never dropped silently.</p>
 *
 * @since 0.1.0
 */
public final class FsAuditWriter implements AuditWriter {
  private static final Logger log = LoggerFactory.getLogger(FsAuditWriter.class);

  private final Path logFile;
  private final AuditEventCodec codec;
  private final MetricsPort metrics;

  public FsAuditWriter(Path logFile) {
    this(logFile, new AuditEventCodec(), MetricsPort.NO_OP);
  }

  public FsAuditWriter(Path logFile, AuditEventCodec codec, MetricsPort metrics) {
    this.logFile = Objects.requireNonNull(logFile, "logFile");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public Path logFile() {
    return logFile;
  }

  @Override
  public synchronized void append(AuditEvent event) throws IOException {
    Objects.requireNonNull(event, "event");
    ByteBuffer line = ByteBuffer.wrap((codec.encode(event) + "\n").getBytes(StandardCharsets.UTF_8));
    try {
      Path parent = logFile.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (FileChannel channel = FileChannel.open(
          logFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
        while (line.hasRemaining()) {
          channel.write(line);
        }
        channel.force(false);
      }
    } catch (IOException ex) {
      metrics.increment("audit.append.failure");
      log.error("Failed to append audit event {} {}/{} to {}",
          event.op(), event.entity(), event.entityId(), logFile, ex);
      throw ex;
    }
    metrics.increment("audit.append.success");
    log.debug("Appended audit event {} {}/{} to {}", event.op(), event.entity(), event.entityId(), logFile);
  }
}
