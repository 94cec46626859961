package dev.ito.api;

import com.fasterxml.jackson.core.JsonGenerator;
import dev.ito.application.audit.AuditStats;
import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.EventFilter;
import dev.ito.domain.audit.ReadResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints event counts grouped by entity, operation, actor and scope.
 *
 * @since 0.1.0
 */
public final class StatsCli {
  private static final Logger log = LoggerFactory.getLogger(StatsCli.class);
  static final String COMMAND = "stats";
  private static final String SUMMARY_USAGE = "usage: stats [change=ID] [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      ito audit stats

      Usage:
        stats [change=ID] [options]

      Options:
        change=ID     Only count events scoped to this change
        root=DIR      Project root (default .)
        config=FILE   YAML configuration file
        --json        Print the counts as JSON
        --verbose     Enable DEBUG logging
        --help        Show this message
      """;

  private StatsCli() {}

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
      if (read.hasIssues()) {
        log.warn("Skipped {} unreadable line(s) in {}", read.issues().size(), config.logFile());
      }
      AuditStats stats = AuditStats.compute(read.events());
      CliPrinter.printLines(input.hasFlag("--json") ? List.of(toJson(stats)) : toText(stats));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read audit log {}", config.logFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while computing statistics", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> toText(AuditStats stats) {
    List<String> lines = new ArrayList<>();
    lines.add("Total events: " + stats.total());
    section(lines, "By entity", stats.byEntity());
    section(lines, "By operation", stats.byOp());
    section(lines, "By actor", stats.byActor());
    section(lines, "By scope", stats.byScope());
    return lines;
  }

  private static void section(List<String> lines, String title, Map<String, Long> counts) {
    if (counts.isEmpty()) {
      return;
    }
    lines.add(title + ":");
    counts.forEach((name, count) -> lines.add(String.format("  %-24s %d", name, count)));
  }

  static String toJson(AuditStats stats) {
    return JsonOutput.render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("total", stats.total());
      writeCounts(gen, "byEntity", stats.byEntity());
      writeCounts(gen, "byOp", stats.byOp());
      writeCounts(gen, "byActor", stats.byActor());
      writeCounts(gen, "byScope", stats.byScope());
      gen.writeEndObject();
    });
  }

  private static void writeCounts(
      JsonGenerator gen, String field, Map<String, Long> counts) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }
}
