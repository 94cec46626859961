package dev.ito.api;

import dev.ito.application.audit.ReconcileService;
import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.Drift;
import dev.ito.domain.audit.DriftKind;
import dev.ito.domain.audit.ReconcileInputException;
import dev.ito.domain.audit.ReconcileReport;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares task state in the audit log with the tasks files and optionally appends compensating events.
 *
 * <p>Exits with {@link ExitCode#DRIFT_DETECTED} when drift was found and {@code --fix} was not given.</p>
 *
 * @since 0.1.0
 */
public final class ReconcileCli {
  private static final Logger log = LoggerFactory.getLogger(ReconcileCli.class);
  static final String COMMAND = "reconcile";
  private static final String SUMMARY_USAGE =
      "usage: reconcile [change=ID] [root=DIR] [config=FILE] [--fix] [--json]";
  private static final String HELP_TEXT = """
      ito audit reconcile

      Usage:
        reconcile [change=ID] [options]

      Options:
        change=ID     Reconcile one change (default: every active change)
        root=DIR      Project root (default .)
        config=FILE   YAML configuration file
        --fix         Append compensating events so the log matches the tasks files
        --json        Print the report as JSON
        --verbose     Enable DEBUG logging
        --help        Show this message

      Exit status is 1 when drift remains.
      """;

  private ReconcileCli() {}

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
    boolean fix = input.hasFlag("--fix");

    AuditConfig config;
    Optional<String> change;
    try {
      Map<String, String> kv = AuditCliSupport.parseArgs(input, SUMMARY_USAGE);
      change = AuditCliSupport.optional(kv, "change");
      kv.remove("change");
      config = AuditCliSupport.resolveConfig(COMMAND, kv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }
    if (fix && !config.enabled()) {
      log.warn("Audit logging is disabled; compensating events will not be persisted");
    }

    try (CompositionRoot root = AuditCliSupport.openRoot(config)) {
      ReconcileService.Outcome outcome =
          root.reconcileService().reconcile(change, fix, root.auditContext());
      if (outcome.skippedLines() > 0) {
        log.warn("Skipped {} unreadable line(s) in {}", outcome.skippedLines(), config.logFile());
      }
      if (input.hasFlag("--json")) {
        CliPrinter.println(toJson(outcome));
      } else {
        CliPrinter.printLines(toText(outcome, fix));
      }
      return outcome.hasUnresolvedDrift() ? ExitCode.DRIFT_DETECTED : ExitCode.SUCCESS;
    } catch (ReconcileInputException ex) {
      log.error("Cannot reconcile: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Reconcile I/O failure under {}", config.itoDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure during reconcile", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> toText(ReconcileService.Outcome outcome, boolean fix) {
    ReconcileReport report = outcome.report();
    List<String> lines = new ArrayList<>();
    lines.add("Reconcile " + outcome.scope() + ": " + report.logEventCount() + " event(s), "
        + report.fileEntityCount() + " task(s) in files");
    if (report.isClean()) {
      lines.add("No drift detected.");
      return lines;
    }
    for (Drift drift : report.drifts()) {
      lines.add("  " + drift.describe());
    }
    lines.add(String.format("%d drift(s): %d diverged, %d unlogged, %d orphaned",
        report.drifts().size(),
        report.count(DriftKind.DIVERGED),
        report.count(DriftKind.UNLOGGED),
        report.count(DriftKind.ORPHANED)));
    lines.add(fix
        ? "Wrote " + outcome.eventsWritten() + " compensating event(s)."
        : "Run with --fix to append compensating events.");
    return lines;
  }

  static String toJson(ReconcileService.Outcome outcome) {
    ReconcileReport report = outcome.report();
    return JsonOutput.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("scope", outcome.scope());
      gen.writeNumberField("events", report.logEventCount());
      gen.writeNumberField("fileEntities", report.fileEntityCount());
      gen.writeBooleanField("clean", report.isClean());
      gen.writeNumberField("eventsWritten", outcome.eventsWritten());
      gen.writeArrayFieldStart("drifts");
      for (Drift drift : report.drifts()) {
        gen.writeStartObject();
        gen.writeStringField("kind", drift.kind().name().toLowerCase(Locale.ROOT));
        gen.writeStringField("entity", drift.key().entity());
        gen.writeStringField("entityId", drift.key().entityId());
        JsonOutput.writeNullableString(gen, "scope", drift.key().scope());
        JsonOutput.writeNullableString(gen, "auditValue", drift.auditValue());
        JsonOutput.writeNullableString(gen, "fileValue", drift.fileValue());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }
}
