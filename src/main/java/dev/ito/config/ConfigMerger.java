package dev.ito.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {
  private static final Set<String> EXPORTERS = Set.of("none", "otlp");

  private ConfigMerger() {}

  /**
   * Builds the effective settings of one command.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value arguments (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message for every CLI key that overrides a YAML key
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> cliValues = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    cliValues.forEach((key, value) -> {
      if (key == null || value == null) {
        return;
      }
      if (yamlValues.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    });

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    String exporter =
        effective.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !EXPORTERS.contains(exporter)) {
      throw new IllegalArgumentException(
          "metricsExporter must be one of " + EXPORTERS + " (was " + exporter + ")");
    }
    String itoDir = effective.getOrDefault("itoDir", ".ito").trim();
    if (itoDir.isEmpty() || itoDir.contains("/") || itoDir.contains("\\") || itoDir.equals("..")) {
      throw new IllegalArgumentException("itoDir must be a single directory name (was '" + itoDir + "')");
    }
    if (!DefaultsForCommand.COMMANDS.contains(command)) {
      throw new IllegalArgumentException("Unknown command: " + command);
    }
  }
}
