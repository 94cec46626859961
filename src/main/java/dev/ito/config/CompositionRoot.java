package dev.ito.config;

import dev.ito.application.audit.AuditContext;
import dev.ito.application.audit.AuditRecorder;
import dev.ito.application.audit.ReconcileService;
import dev.ito.application.port.AuditEventSource;
import dev.ito.application.port.AuditWriter;
import dev.ito.application.port.ClockPort;
import dev.ito.application.port.GitPort;
import dev.ito.application.port.MetricsPort;
import dev.ito.domain.audit.EventContext;
import dev.ito.infrastructure.audit.AuditEventCodec;
import dev.ito.infrastructure.audit.AuditLogReader;
import dev.ito.infrastructure.audit.AuditLogStreamWatcher;
import dev.ito.infrastructure.audit.FsAuditWriter;
import dev.ito.infrastructure.context.EventContextResolver;
import dev.ito.infrastructure.git.ProcessGitAdapter;
import dev.ito.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import dev.ito.infrastructure.tasks.TasksMarkdownFileStateSource;
import dev.ito.infrastructure.time.SystemClockAdapter;
import dev.ito.infrastructure.worktree.GitWorktreeDiscovery;
import dev.ito.infrastructure.worktree.WorktreeEventAggregator;
import java.nio.file.Files;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the audit use cases to their file, git and metrics adapters.
 * <p><strong>Role:</strong> Single place where an {@link AuditConfig} becomes live objects; CLI commands ask it
 * for services and never construct adapters themselves.</p>
 * <p><strong>Writer selection:</strong> {@link FsAuditWriter} when auditing is enabled and the state directory
 * exists, {@link AuditWriter#NO_OP} otherwise.</p>
 * <p><strong>Lifecycle:</strong> Owns the metrics adapter; close it to flush exporters.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final AuditConfig config;
  private final GitPort git;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final UnaryOperator<String> environment;
  private final AuditEventCodec codec = new AuditEventCodec();
  private AuditContext auditContext;

  public CompositionRoot(AuditConfig config) {
    this(config, new ProcessGitAdapter(), new SystemClockAdapter(),
        new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint()), System::getenv);
  }

  /**
   * Test-friendly constructor with injectable collaborators.
   *
   * @param config effective configuration
   * @param git git command runner
   * @param clock time source
   * @param metrics metrics sink
   * @param environment environment variable lookup
   */
  public CompositionRoot(
      AuditConfig config,
      GitPort git,
      ClockPort clock,
      MetricsPort metrics,
      UnaryOperator<String> environment) {
    this.config = Objects.requireNonNull(config, "config");
    this.git = Objects.requireNonNull(git, "git");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  public AuditConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public AuditLogReader logReader() {
    return new AuditLogReader(codec, metrics);
  }

  public AuditLogStreamWatcher streamWatcher() {
    return new AuditLogStreamWatcher(codec, metrics);
  }

  public AuditEventSource eventSource() {
    AuditLogReader reader = logReader();
    return filter -> reader.readFiltered(config.logFile(), filter);
  }

  public GitWorktreeDiscovery worktreeDiscovery() {
    return new GitWorktreeDiscovery(git);
  }

  public WorktreeEventAggregator worktreeAggregator() {
    return new WorktreeEventAggregator(logReader(), config.itoDirName(), metrics);
  }

  public ReconcileService reconcileService() {
    return new ReconcileService(
        eventSource(), new TasksMarkdownFileStateSource(), config.itoDir(), metrics);
  }

  /**
   * Writer for this run.
   *
   * @return filesystem writer, or the discarding writer when auditing is off or the project is uninitialised
   */
  public AuditWriter auditWriter() {
    if (!config.enabled()) {
      log.debug("Audit logging disabled by configuration");
      return AuditWriter.NO_OP;
    }
    if (!Files.isDirectory(config.itoDir())) {
      log.debug("No {} directory under {}; audit events are discarded",
          config.itoDirName(), config.projectRoot());
      return AuditWriter.NO_OP;
    }
    return new FsAuditWriter(config.logFile(), codec, metrics);
  }

  /**
   * Lazily resolved audit context: session, git context and user identity are looked up once per run.
   *
   * @return context shared by recorders and reconciliation
   */
  public synchronized AuditContext auditContext() {
    if (auditContext == null) {
      EventContextResolver resolver = new EventContextResolver(git, environment);
      EventContext eventContext = resolver.resolve(config.projectRoot(), config.itoDir());
      String identity = resolver.resolveUserIdentity(config.projectRoot());
      auditContext = new AuditContext(auditWriter(), eventContext, identity, clock);
    }
    return auditContext;
  }

  public AuditRecorder auditRecorder() {
    return new AuditRecorder(auditContext());
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
