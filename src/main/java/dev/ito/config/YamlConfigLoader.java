package dev.ito.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads audit CLI settings from YAML and flattens them into dotted key/value pairs.
 *
 * <pre>
 * common:
 *   itoDir: .ito
 *   metricsExporter: none
 * stream:
 *   pollIntervalMillis: 250
 *   last: 20
 * </pre>
 *
 * <p>The {@code common} section applies to every command; a section named after the command overrides it.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges the {@code common} section with the {@code command} section.
   *
   * @param path YAML file
   * @param command CLI command name
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    for (String section : new String[] {"common", command.trim().toLowerCase(Locale.ROOT)}) {
      Object node = section(root, section);
      if (node != null) {
        flatten(asMap(node, section), "", flattened);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key.trim(), entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(entry -> entry.getKey().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + key);
      } else {
        target.put(key, value.toString());
      }
    }
  }
}
