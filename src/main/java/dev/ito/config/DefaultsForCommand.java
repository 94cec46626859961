package dev.ito.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default settings for each audit CLI command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForCommand {
  /** Commands that accept configuration. */
  public static final Set<String> COMMANDS =
      Set.of("record", "log", "reconcile", "validate", "stats", "stream", "worktrees");

  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "root", ".",
      "itoDir", ".ito",
      "enabled", "true",
      "metricsExporter", "none",
      "otelEndpoint", "");

  private DefaultsForCommand() {}

  /**
   * Returns defaults for {@code command} merged over the common defaults.
   *
   * @param command CLI command name
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    if (!COMMANDS.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    switch (normalized) {
      case "log" -> defaults.put("limit", "0");
      case "stream" -> {
        defaults.put("pollIntervalMillis", "500");
        defaults.put("last", "10");
      }
      default -> {
        // common defaults only
      }
    }
    return Map.copyOf(defaults);
  }
}
