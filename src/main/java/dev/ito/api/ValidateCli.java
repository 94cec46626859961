package dev.ito.api;

import dev.ito.application.audit.AuditValidator;
import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.ReadResult;
import dev.ito.domain.audit.ValidationIssue;
import dev.ito.domain.audit.ValidationReport;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the audit log for unreadable lines and inconsistent history.
 *
 * @since 0.1.0
 */
public final class ValidateCli {
  private static final Logger log = LoggerFactory.getLogger(ValidateCli.class);
  static final String COMMAND = "validate";
  private static final String SUMMARY_USAGE = "usage: validate [change=ID] [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      ito audit validate

      Usage:
        validate [change=ID] [options]

      Errors: unreadable lines and unsupported schema versions.
      Warnings: duplicate creation, status transitions whose from value does not match the
      previous value, timestamps that go backwards.

      Options:
        change=ID     Only validate events scoped to this change
        root=DIR      Project root (default .)
        config=FILE   YAML configuration file
        --json        Print the report as JSON
        --verbose     Enable DEBUG logging
        --help        Show this message

      Exit status is 1 when errors were found.
      """;

  private ValidateCli() {}

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
    Optional<String> change;
    try {
      Map<String, String> kv = AuditCliSupport.parseArgs(input, SUMMARY_USAGE);
      change = AuditCliSupport.optional(kv, "change");
      kv.remove("change");
      config = AuditCliSupport.resolveConfig(COMMAND, kv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    try (CompositionRoot root = AuditCliSupport.openRoot(config)) {
      EventFilter filter =
          change.map(id -> EventFilter.builder().scope(id).build()).orElse(EventFilter.all());
      ReadResult read = root.logReader().readFiltered(config.logFile(), filter);
      ValidationReport report = AuditValidator.validate(read);
      if (input.hasFlag("--json")) {
        CliPrinter.println(toJson(report));
      } else {
        CliPrinter.printLines(toText(report));
      }
      return report.valid() ? ExitCode.SUCCESS : ExitCode.DRIFT_DETECTED;
    } catch (IOException ex) {
      log.error("Failed to read audit log {}", config.logFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure during validation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> toText(ValidationReport report) {
    List<String> lines = new ArrayList<>();
    lines.add("Validated " + report.eventCount() + " event(s): " + (report.valid() ? "valid" : "invalid"));
    for (ValidationIssue issue : report.issues()) {
      String position = issue.eventIndex() == null ? "" : " [event " + issue.eventIndex() + "]";
      lines.add("  " + issue.level() + position + ": " + issue.message());
    }
    return lines;
  }

  static String toJson(ValidationReport report) {
    return JsonOutput.render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("events", report.eventCount());
      gen.writeBooleanField("valid", report.valid());
      gen.writeArrayFieldStart("issues");
      for (ValidationIssue issue : report.issues()) {
        gen.writeStartObject();
        gen.writeStringField("level", issue.level().name().toLowerCase(Locale.ROOT));
        gen.writeStringField("message", issue.message());
        if (issue.eventIndex() != null) {
          gen.writeNumberField("eventIndex", issue.eventIndex());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }
}
