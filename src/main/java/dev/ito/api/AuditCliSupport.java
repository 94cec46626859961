package dev.ito.api;

import dev.ito.config.AuditConfig;
import dev.ito.config.CompositionRoot;
import dev.ito.config.ConfigMerger;
import dev.ito.config.DefaultsForCommand;
import dev.ito.config.YamlConfigLoader;
import dev.ito.domain.audit.AuditTimestamps;
import dev.ito.domain.audit.EventFilter;
import dev.ito.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argument and configuration plumbing shared by the audit commands.
 *
 * <p>Every helper logs the problem itself and signals the exit code through {@link CliAbort}.</p>
 */
final class AuditCliSupport {
  private static final Logger log = LoggerFactory.getLogger(AuditCliSupport.class);
  private static final Function<AuditConfig, CompositionRoot> DEFAULT_ROOT_FACTORY = CompositionRoot::new;

  private static volatile Function<AuditConfig, CompositionRoot> rootFactory = DEFAULT_ROOT_FACTORY;

  private AuditCliSupport() {
    // Utility
  }

  static void enableVerboseIfRequested(CliInput input, String command) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }
  }

  static Map<String, String> parseArgs(CliInput input, String usage) throws CliAbort {
    try {
      return CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Resolves the effective configuration: CLI pairs over the optional {@code config=} YAML file over defaults.
   * The {@code config} key is removed from {@code cliArgs}.
   */
  static AuditConfig resolveConfig(String command, Map<String, String> cliArgs, String usage)
      throws CliAbort {
    String configPath = cliArgs.remove("config");
    Optional<Map<String, String>> yaml = loadYaml(configPath, command, usage);
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          command, yaml, cliArgs, DefaultsForCommand.asFlatMap(command), log::warn);
      AuditConfig config = AuditConfig.fromMap(effective);
      log.debug("Effective {} configuration: root={}, itoDir={}, enabled={}",
          command, config.projectRoot(), config.itoDirName(), config.enabled());
      return config;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String command, String usage)
      throws CliAbort {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, command);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /**
   * Builds an event filter from {@code entity}, {@code id}, {@code scope}, {@code op}, {@code actor},
   * {@code since} and {@code until}.
   */
  static EventFilter parseFilter(Map<String, String> args, String usage) throws CliAbort {
    try {
      return EventFilter.builder()
          .entity(optional(args, "entity").orElse(null))
          .entityId(optional(args, "id").orElse(null))
          .scope(optional(args, "scope").orElse(null))
          .op(optional(args, "op").orElse(null))
          .actor(optional(args, "actor").orElse(null))
          .since(parseInstant("since", args.get("since")))
          .until(parseInstant("until", args.get("until")))
          .build();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid filter: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  static Optional<String> optional(Map<String, String> args, String key) {
    String value = args.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  static CompositionRoot openRoot(AuditConfig config) {
    return rootFactory.apply(config);
  }

  static void setRootFactoryForTesting(Function<AuditConfig, CompositionRoot> factory) {
    rootFactory = factory;
  }

  static void clearRootFactory() {
    rootFactory = DEFAULT_ROOT_FACTORY;
  }

  private static Instant parseInstant(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return AuditTimestamps.parse(raw.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException(name + " must be an ISO-8601 timestamp (was '" + raw + "')", ex);
    }
  }
}
