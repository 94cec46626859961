package dev.ito.validation;

/**
 * Numeric validation for CLI and configuration values such as limits and poll intervals.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Parses a decimal integer and checks it against an inclusive range.
   *
   * @param name parameter name for diagnostics
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside {@code [min, max]}
   */
  public static long parseInRange(String name, String raw, long min, long max) {
    long value;
    try {
      value = Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name for diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
