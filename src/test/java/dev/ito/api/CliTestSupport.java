package dev.ito.api;

import dev.ito.application.port.AuditWriter;
import dev.ito.application.port.RecordingMetricsPort;
import dev.ito.application.port.ScriptedGitPort;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.infrastructure.audit.AuditPaths;
import dev.ito.infrastructure.audit.FsAuditWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Wires CLI commands to a fake git, a fixed clock and captured stdout.
 */
final class CliTestSupport {
  static final long NOW = Instant.parse("2026-03-01T12:00:00Z").toEpochMilli();

  private final StringWriter stdout = new StringWriter();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  CliTestSupport() {
    CliPrinter.setWriterForTesting(new PrintWriter(stdout));
    AuditCliSupport.setRootFactoryForTesting(config -> new CompositionRoot(
        config,
        new ScriptedGitPort().answer("config user.name", "Jane Doe"),
        () -> NOW,
        metrics,
        name -> null));
  }

  static void reset() {
    CliPrinter.clearTestWriter();
    AuditCliSupport.clearRootFactory();
  }

  String stdout() {
    return stdout.toString();
  }

  RecordingMetricsPort metrics() {
    return metrics;
  }

  static Path logFile(Path project) {
    return AuditPaths.logFile(project.resolve(AuditPaths.DEFAULT_ITO_DIR));
  }

  static void seed(Path project, AuditEvent... events) throws IOException {
    AuditWriter writer = new FsAuditWriter(logFile(project));
    for (AuditEvent event : events) {
      writer.append(event);
    }
  }

  static String root(Path project) {
    return "root=" + project;
  }
}
