package dev.ito.api;

import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.StreamCursor;
import dev.ito.domain.audit.StreamEvent;
import dev.ito.domain.audit.WorktreeInfo;
import dev.ito.infrastructure.audit.AuditEventCodec;
import dev.ito.infrastructure.audit.AuditLogStreamWatcher;
import dev.ito.infrastructure.audit.StreamBatch;
import dev.ito.infrastructure.audit.StreamConfig;
import dev.ito.infrastructure.worktree.WorktreeStreamSession;
import dev.ito.validation.Numbers;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tails the audit log: prints the newest events, then polls for appended ones.
 *
 * <p>The loop ends after {@code maxPolls} polls or on interrupt; either way the resume cursor is printed so a
 * later run can pass it back through {@code cursor=}.</p>
 *
 * @since 0.1.0
 */
public final class StreamCli {
  private static final Logger log = LoggerFactory.getLogger(StreamCli.class);
  static final String COMMAND = "stream";
  private static final String SUMMARY_USAGE =
      "usage: stream [last=N] [interval=MILLIS] [cursor=TOKEN] [maxPolls=N] [root=DIR] [config=FILE]"
          + " [--all-worktrees] [--json]";
  private static final String HELP_TEXT = """
      ito audit stream

      Usage:
        stream [options]

      Options:
        last=N             Initial events to show (default 10, 0 = all)
        interval=MILLIS    Poll interval, 10..60000 (default 500); alias pollIntervalMillis
        cursor=TOKEN       Resume after a cursor printed by an earlier run
        maxPolls=N         Stop after N polls (default 0 = until interrupted)
        root=DIR           Project root (default .)
        config=FILE        YAML configuration file
        --all-worktrees    Follow the logs of every git worktree
        --json             Print one JSON object per event, including its cursor
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private StreamCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    AuditCliSupport.enableVerboseIfRequested(input, COMMAND);
    boolean json = input.hasFlag("--json");
    boolean allWorktrees = input.hasFlag("--all-worktrees");

    AuditConfig config;
    Optional<StreamCursor> cursor;
    long maxPolls;
    try {
      Map<String, String> kv = AuditCliSupport.parseArgs(input, SUMMARY_USAGE);
      String interval = kv.remove("interval");
      if (interval != null) {
        kv.put("pollIntervalMillis", interval);
      }
      cursor = parseCursor(kv.remove("cursor"));
      maxPolls = parseMaxPolls(kv.remove("maxPolls"));
      config = AuditCliSupport.resolveConfig(COMMAND, kv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }
    if (allWorktrees && cursor.isPresent()) {
      log.warn("cursor= applies to a single log and is ignored with --all-worktrees");
      cursor = Optional.empty();
    }
    StreamConfig streamConfig = new StreamConfig(config.pollInterval(), allWorktrees, config.last(), cursor);

    try (CompositionRoot root = AuditCliSupport.openRoot(config)) {
      Follower follower = allWorktrees
          ? new WorktreesFollower(root, streamConfig)
          : new SingleLogFollower(root.streamWatcher(), config.logFile(), streamConfig);
      return follow(follower, streamConfig, maxPolls, json);
    } catch (IOException ex) {
      log.error("Failed to read audit log {}", config.logFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while streaming audit events", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode follow(Follower follower, StreamConfig streamConfig, long maxPolls, boolean json)
      throws IOException {
    AuditEventCodec codec = new AuditEventCodec();
    emit(follower.initial(), codec, json);
    long polls = 0;
    try {
      while (maxPolls == 0 || polls < maxPolls) {
        Thread.sleep(streamConfig.pollInterval().toMillis());
        emit(follower.poll(), codec, json);
        polls++;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Stream interrupted after {} poll(s)", polls);
      CliPrinter.printLines(follower.resumeLines());
      return ExitCode.INTERRUPTED;
    }
    CliPrinter.printLines(follower.resumeLines());
    return ExitCode.SUCCESS;
  }

  private static void emit(List<StreamEvent> events, AuditEventCodec codec, boolean json) {
    if (events.isEmpty()) {
      return;
    }
    List<String> lines = new ArrayList<>(events.size());
    for (StreamEvent event : events) {
      lines.add(json ? toJson(event, codec) : EventRenderer.text(event.event(), event.source()));
    }
    CliPrinter.printLines(lines);
  }

  static String toJson(StreamEvent event, AuditEventCodec codec) {
    return JsonOutput.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("cursor", event.cursor().token());
      if (!event.source().isEmpty()) {
        gen.writeStringField("source", event.source());
      }
      gen.writeFieldName("event");
      gen.writeRawValue(codec.encode(event.event()));
      gen.writeEndObject();
    });
  }

  private static Optional<StreamCursor> parseCursor(String token) throws CliAbort {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(StreamCursor.parse(token));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid cursor: {}", ex.getMessage());
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static long parseMaxPolls(String raw) throws CliAbort {
    if (raw == null || raw.isBlank()) {
      return 0;
    }
    try {
      return Numbers.parseInRange("maxPolls", raw, 0, Long.MAX_VALUE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private interface Follower {
    List<StreamEvent> initial() throws IOException;

    List<StreamEvent> poll() throws IOException;

    List<String> resumeLines();
  }

  private static final class SingleLogFollower implements Follower {
    private final AuditLogStreamWatcher watcher;
    private final Path logFile;
    private final StreamConfig config;
    private StreamCursor cursor = StreamCursor.START;

    SingleLogFollower(AuditLogStreamWatcher watcher, Path logFile, StreamConfig config) {
      this.watcher = watcher;
      this.logFile = logFile;
      this.config = config;
    }

    @Override
    public List<StreamEvent> initial() throws IOException {
      return consume(watcher.readInitialEvents(logFile, config, ""));
    }

    @Override
    public List<StreamEvent> poll() throws IOException {
      return consume(watcher.pollNewEvents(logFile, cursor, ""));
    }

    private List<StreamEvent> consume(StreamBatch batch) {
      if (!batch.issues().isEmpty()) {
        log.warn("Skipped {} unreadable line(s) in {}", batch.issues().size(), logFile);
      }
      cursor = batch.cursor();
      return batch.events();
    }

    @Override
    public List<String> resumeLines() {
      return List.of("cursor=" + cursor.token());
    }
  }

  private static final class WorktreesFollower implements Follower {
    private final WorktreeStreamSession session;
    private final StreamConfig config;

    WorktreesFollower(CompositionRoot root, StreamConfig config) {
      List<WorktreeInfo> worktrees =
          root.worktreeDiscovery().discoverWorktrees(root.config().projectRoot());
      this.session = new WorktreeStreamSession(root.streamWatcher(), worktrees, root.config().itoDirName());
      this.config = config;
    }

    @Override
    public List<StreamEvent> initial() {
      return session.readInitial(config);
    }

    @Override
    public List<StreamEvent> poll() {
      return session.poll();
    }

    @Override
    public List<String> resumeLines() {
      List<String> lines = new ArrayList<>();
      session.cursors().forEach((worktree, cursor) ->
          lines.add("cursor[" + worktree.label() + "]=" + cursor.token()));
      lines.sort(null);
      return lines;
    }
  }
}
