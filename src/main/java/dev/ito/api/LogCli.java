package dev.ito.api;

import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.ReadResult;
import dev.ito.domain.audit.WorktreeInfo;
import dev.ito.infrastructure.audit.AuditEventCodec;
import dev.ito.infrastructure.worktree.AggregatedEvents;
import dev.ito.infrastructure.worktree.ExcludedWorktree;
import dev.ito.infrastructure.worktree.WorktreeEvent;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints audit events, optionally filtered and merged across every worktree.
 *
 * @since 0.1.0
 */
public final class LogCli {
  private static final Logger log = LoggerFactory.getLogger(LogCli.class);
  static final String COMMAND = "log";
  private static final String SUMMARY_USAGE =
      "usage: log [entity=KIND] [id=ID] [scope=SCOPE] [op=OP] [actor=ACTOR] [since=TS] [until=TS]"
          + " [limit=N] [root=DIR] [config=FILE] [--json] [--all-worktrees]";
  private static final String HELP_TEXT = """
      ito audit log

      Usage:
        log [filters] [options]

      Filters (all optional, combined with AND):
        entity=KIND       Entity kind
        id=ID             Entity identifier
        scope=SCOPE       Containing change or module
        op=OP             Operation
        actor=ACTOR       Actor category
        since=TS          Earliest timestamp, ISO-8601, inclusive
        until=TS          Latest timestamp, ISO-8601, inclusive

      Options:
        limit=N           Show only the newest N events (0 = all)
        root=DIR          Project root (default .)
        config=FILE       YAML configuration file
        --all-worktrees   Merge the logs of every git worktree
        --json            Print one JSON record per line
        --verbose         Enable DEBUG logging
        --help            Show this message
      """;

  private LogCli() {}

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
    EventFilter filter;
    try {
      Map<String, String> kv = AuditCliSupport.parseArgs(input, SUMMARY_USAGE);
      filter = AuditCliSupport.parseFilter(kv, SUMMARY_USAGE);
      config = AuditCliSupport.resolveConfig(COMMAND, kv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    try (CompositionRoot root = AuditCliSupport.openRoot(config)) {
      List<Row> rows = allWorktrees ? aggregated(root, filter) : single(root, filter);
      if (config.limit() > 0 && rows.size() > config.limit()) {
        rows = rows.subList(rows.size() - config.limit(), rows.size());
      }
      print(rows, json);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read audit log {}", config.logFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while reading audit events", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static List<Row> single(CompositionRoot root, EventFilter filter) throws IOException {
    ReadResult read = root.logReader().readFiltered(root.config().logFile(), filter);
    if (read.hasIssues()) {
      log.warn("Skipped {} unreadable line(s) in {}", read.issues().size(), root.config().logFile());
    }
    return read.events().stream().map(event -> new Row(event, null)).toList();
  }

  private static List<Row> aggregated(CompositionRoot root, EventFilter filter) {
    List<WorktreeInfo> worktrees =
        root.worktreeDiscovery().discoverWorktrees(root.config().projectRoot());
    AggregatedEvents aggregated = root.worktreeAggregator().aggregate(worktrees, filter);
    for (ExcludedWorktree excluded : aggregated.excluded()) {
      log.warn("Worktree {} excluded: {}", excluded.worktree().path(), excluded.reason());
    }
    if (aggregated.skippedLines() > 0) {
      log.warn("Skipped {} unreadable line(s) across {} worktree(s)",
          aggregated.skippedLines(), worktrees.size());
    }
    List<Row> rows = new ArrayList<>(aggregated.events().size());
    for (WorktreeEvent tagged : aggregated.events()) {
      rows.add(new Row(tagged.event(), tagged.worktree().label()));
    }
    return rows;
  }

  private static void print(List<Row> rows, boolean json) {
    if (rows.isEmpty()) {
      if (!json) {
        CliPrinter.println("No audit events found.");
      }
      return;
    }
    AuditEventCodec codec = new AuditEventCodec();
    List<String> lines = new ArrayList<>(rows.size());
    for (Row row : rows) {
      lines.add(json ? codec.encode(row.event()) : EventRenderer.text(row.event(), row.source()));
    }
    CliPrinter.printLines(lines);
  }

  private record Row(AuditEvent event, String source) {}
}
