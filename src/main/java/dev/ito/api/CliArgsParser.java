package dev.ito.api;

import dev.ito.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable, insertion-ordered map.
 *
 * <p>Values are split on the first {@code '='} only, so JSON such as {@code meta={"a":"b=c"}} survives intact.
 * Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments; a repeated key keeps its last value.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map of arguments
   * @throws IllegalArgumentException when an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, Strings.blankToNull(value) == null ? "" : value);
    }
    return map;
  }
}
