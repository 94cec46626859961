package dev.ito.api;

import dev.ito.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ito-audit} dispatcher that routes to the audit commands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: ito-audit <record|log|reconcile|validate|stats|stream|worktrees> [options]";
  private static final String HELP_TEXT = """
      ito audit event log

      Usage:
        ito-audit <command> [key=value ...] [flags]

      Commands:
        record      Append one audit event
        log         Show audit events, optionally across worktrees
        reconcile   Compare the log with the tasks files; --fix appends compensating events
        validate    Check the log for unreadable lines and inconsistent history
        stats       Count events by entity, operation, actor and scope
        stream      Follow the log as events are appended
        worktrees   List git worktrees and their audit logs

      Global flags:
        --help      Show this message (or <command> --help for details)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command without terminating the JVM.
   *
   * @param args arguments; the first non-flag token names the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = commandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case RecordCli.COMMAND -> RecordCli.run(delegateArgs);
      case LogCli.COMMAND -> LogCli.run(delegateArgs);
      case ReconcileCli.COMMAND -> ReconcileCli.run(delegateArgs);
      case ValidateCli.COMMAND -> ValidateCli.run(delegateArgs);
      case StatsCli.COMMAND -> StatsCli.run(delegateArgs);
      case StreamCli.COMMAND -> StreamCli.run(delegateArgs);
      case WorktreesCli.COMMAND -> WorktreesCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int commandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !"help".equalsIgnoreCase(arg)) {
        return i;
      }
    }
    return -1;
  }
}
