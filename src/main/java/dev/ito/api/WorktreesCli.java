package dev.ito.api;

import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.WorktreeInfo;
import dev.ito.infrastructure.audit.AuditPaths;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the git worktrees of the project and where each keeps its audit log.
 *
 * @since 0.1.0
 */
public final class WorktreesCli {
  private static final Logger log = LoggerFactory.getLogger(WorktreesCli.class);
  static final String COMMAND = "worktrees";
  private static final String SUMMARY_USAGE = "usage: worktrees [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      ito audit worktrees

      Usage:
        worktrees [options]

      Options:
        root=DIR      Project root (default .)
        config=FILE   YAML configuration file
        --json        Print the worktrees as JSON
        --verbose     Enable DEBUG logging
        --help        Show this message
      """;

  private WorktreesCli() {}

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

    AuditConfig config;
    try {
      Map<String, String> kv = AuditCliSupport.parseArgs(input, SUMMARY_USAGE);
      config = AuditCliSupport.resolveConfig(COMMAND, kv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    try (CompositionRoot root = AuditCliSupport.openRoot(config)) {
      List<WorktreeInfo> worktrees = root.worktreeDiscovery().discoverWorktrees(config.projectRoot());
      if (input.hasFlag("--json")) {
        CliPrinter.println(toJson(worktrees, config.itoDirName()));
      } else {
        CliPrinter.printLines(toText(worktrees, config.itoDirName()));
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while listing worktrees", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> toText(List<WorktreeInfo> worktrees, String itoDirName) {
    List<String> lines = new ArrayList<>(worktrees.size());
    for (WorktreeInfo worktree : worktrees) {
      Path logFile = AuditPaths.logFileForWorktree(worktree.path(), itoDirName);
      lines.add(String.format("%s%-20s %s  log: %s%s",
          worktree.main() ? "* " : "  ",
          worktree.branch() == null ? "(detached)" : worktree.branch(),
          worktree.path(),
          logFile,
          Files.exists(logFile) ? "" : " (missing)"));
    }
    return lines;
  }

  static String toJson(List<WorktreeInfo> worktrees, String itoDirName) {
    return JsonOutput.render(gen -> {
      gen.writeStartArray();
      for (WorktreeInfo worktree : worktrees) {
        Path logFile = AuditPaths.logFileForWorktree(worktree.path(), itoDirName);
        gen.writeStartObject();
        gen.writeStringField("path", worktree.path().toString());
        JsonOutput.writeNullableString(gen, "branch", worktree.branch());
        gen.writeBooleanField("main", worktree.main());
        gen.writeStringField("log", logFile.toString());
        gen.writeBooleanField("logExists", Files.exists(logFile));
        gen.writeEndObject();
      }
      gen.writeEndArray();
    });
  }
}
