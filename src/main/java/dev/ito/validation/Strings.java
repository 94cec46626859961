package dev.ito.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation for CLI arguments and configuration values.
 * <p><strong>Why:</strong> Identifiers such as change ids and actor names end up in audit records and file paths,
 * so blanks and control characters are rejected at the boundary.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code null} becomes {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Returns the trimmed value, or {@code null} when it is {@code null} or blank.
   *
   * @param value candidate text
   * @return trimmed text or {@code null}
   */
  public static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
