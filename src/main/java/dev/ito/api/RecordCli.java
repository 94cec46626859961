package dev.ito.api;

import dev.ito.application.audit.AuditContext;
import dev.ito.application.audit.AuditRecorder;
import dev.ito.application.port.AuditWriter;
import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.domain.audit.AuditActors;
import dev.ito.domain.audit.AuditEvent;
import dev.ito.infrastructure.audit.AuditEventCodec;
import dev.ito.infrastructure.audit.JsonSupport;
import dev.ito.validation.Strings;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends one audit event describing a state transition.
 *
 * @since 0.1.0
 */
public final class RecordCli {
  private static final Logger log = LoggerFactory.getLogger(RecordCli.class);
  static final String COMMAND = "record";
  private static final String SUMMARY_USAGE =
      "usage: record entity=KIND id=ID op=OP [scope=SCOPE] [from=VALUE] [to=VALUE]"
          + " [actor=cli|reconcile|ralph|agent] [by=@NAME] [meta=JSON] [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      ito audit record

      Usage:
        record entity=KIND id=ID op=OP [options]

      Required:
        entity=KIND      Entity kind, for example task, change, module, wave, planning
        id=ID            Entity identifier, for example 1.1
        op=OP            Operation, for example create, status_change, archive

      Options:
        scope=SCOPE      Containing change or module
        from=VALUE       Previous value
        to=VALUE         New value
        actor=KIND       Actor category (default cli)
        by=@NAME         Identity (default: git user.name as @lower-hyphenated)
        meta=JSON        Free-form JSON metadata
        root=DIR         Project root (default .)
        config=FILE      YAML configuration file
        --json           Print the appended event as JSON
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private RecordCli() {}

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

    AuditRecorder.Transition transition;
    AuditConfig config;
    try {
      Map<String, String> kv = AuditCliSupport.parseArgs(input, SUMMARY_USAGE);
      transition = toTransition(kv);
      config = AuditCliSupport.resolveConfig(COMMAND, kv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    try (CompositionRoot root = AuditCliSupport.openRoot(config)) {
      AuditContext context = root.auditContext();
      if (context.writer() == AuditWriter.NO_OP) {
        log.warn("Audit logging is disabled or {} does not exist; the event is not persisted",
            config.itoDir());
      }
      AuditEvent event = new AuditRecorder(context).record(transition);
      CliPrinter.println(input.hasFlag("--json")
          ? new AuditEventCodec().encode(event)
          : "Recorded " + EventRenderer.text(event));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to append audit event to {}", config.logFile(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Invalid audit event: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while recording audit event", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static AuditRecorder.Transition toTransition(Map<String, String> kv) throws CliAbort {
    String entity = kv.remove("entity");
    String id = kv.remove("id");
    String op = kv.remove("op");
    if (isBlank(entity) || isBlank(id) || isBlank(op)) {
      log.error("record requires entity=, id= and op=");
      CliPrinter.println(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    Object meta = null;
    String metaText = kv.remove("meta");
    if (!isBlank(metaText)) {
      try {
        meta = new JsonSupport().parse(metaText);
      } catch (IllegalArgumentException ex) {
        log.error("meta must be valid JSON: {}", ex.getMessage());
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
    }
    String actor = kv.remove("actor");
    return new AuditRecorder.Transition(
        entity,
        id,
        Strings.blankToNull(kv.remove("scope")),
        op,
        Strings.blankToNull(kv.remove("from")),
        Strings.blankToNull(kv.remove("to")),
        isBlank(actor) ? AuditActors.CLI : actor,
        Strings.blankToNull(kv.remove("by")),
        meta);
  }

  private static boolean isBlank(String value) {
    return Strings.blankToNull(value) == null;
  }
}
