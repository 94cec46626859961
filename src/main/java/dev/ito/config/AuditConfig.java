package dev.ito.config;

import dev.ito.infrastructure.audit.AuditPaths;
import dev.ito.validation.Numbers;
import dev.ito.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Effective settings of one audit CLI run.
 *
 * @param projectRoot project working directory
 * @param itoDirName name of the state directory below each worktree root
 * @param enabled whether events are persisted; {@code false} wires the discarding writer
 * @param pollInterval stream poll interval
 * @param last initial events shown by {@code stream}
 * @param limit maximum events shown by {@code log}; {@code 0} means unlimited
 * @param metricsExporter {@code none} or {@code otlp}
 * @param otelEndpoint OTLP endpoint; blank uses the OpenTelemetry defaults
 * @since 0.1.0
 */
public record AuditConfig(
    Path projectRoot,
    String itoDirName,
    boolean enabled,
    Duration pollInterval,
    int last,
    int limit,
    String metricsExporter,
    String otelEndpoint) {

  public AuditConfig {
    projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
    itoDirName = Strings.requireNonBlank("itoDir", itoDirName);
    Objects.requireNonNull(pollInterval, "pollInterval");
    metricsExporter = metricsExporter == null ? "none" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
  }

  /**
   * Defaults for a project rooted at {@code projectRoot}.
   *
   * @param projectRoot project working directory
   * @return default configuration
   */
  public static AuditConfig defaults(Path projectRoot) {
    return new AuditConfig(
        projectRoot, AuditPaths.DEFAULT_ITO_DIR, true, Duration.ofMillis(500), 10, 0, "none", "");
  }

  /**
   * Builds a configuration from a flattened key/value map (see {@link DefaultsForCommand}).
   *
   * @param values merged settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static AuditConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    AuditConfig defaults = defaults(Path.of(values.getOrDefault("root", ".")));
    return new AuditConfig(
        defaults.projectRoot(),
        values.getOrDefault("itoDir", defaults.itoDirName()),
        parseBoolean("enabled", values.get("enabled"), defaults.enabled()),
        values.containsKey("pollIntervalMillis")
            ? Duration.ofMillis(
                Numbers.parseInRange("pollIntervalMillis", values.get("pollIntervalMillis"), 10, 60_000))
            : defaults.pollInterval(),
        values.containsKey("last")
            ? (int) Numbers.parseInRange("last", values.get("last"), 0, 100_000)
            : defaults.last(),
        values.containsKey("limit")
            ? (int) Numbers.parseInRange("limit", values.get("limit"), 0, Integer.MAX_VALUE)
            : defaults.limit(),
        values.getOrDefault("metricsExporter", defaults.metricsExporter()),
        values.getOrDefault("otelEndpoint", defaults.otelEndpoint()));
  }

  public Path itoDir() {
    return projectRoot.resolve(itoDirName);
  }

  public Path logFile() {
    return AuditPaths.logFile(itoDir());
  }

  private static boolean parseBoolean(String name, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + raw + "')");
    };
  }
}
