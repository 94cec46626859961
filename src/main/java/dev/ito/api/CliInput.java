package dev.ito.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into switches ({@code --json}) and {@code key=value} pairs.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] positional;
  private final Set<String> flags;

  private CliInput(String[] positional, Set<String> flags) {
    this.positional = positional;
    this.flags = flags;
  }

  /**
   * Parses raw arguments. Help and verbose aliases are normalised to {@code --help} and {@code --verbose}.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(positional.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Non-switch arguments in order: the command name for the dispatcher, {@code key=value} pairs otherwise.
   *
   * @return copy of the positional arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(positional, positional.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a switch such as {@code --fix}, case-insensitively.
   *
   * @param flag switch to look up
   * @return {@code true} when supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }
}
