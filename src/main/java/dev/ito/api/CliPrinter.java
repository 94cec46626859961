package dev.ito.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes command results to stdout. Diagnostics go through SLF4J, which Logback sends to stderr, so piped
 * output ({@code log --json | jq}) stays clean.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  public static void printLines(String... lines) {
    if (lines != null) {
      printLines(List.of(lines));
    }
  }

  /**
   * Prints each line, then flushes once.
   *
   * @param lines lines to emit
   */
  public static void printLines(List<String> lines) {
    PrintWriter writer = writer();
    lines.forEach(writer::println);
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter active = override;
    return active != null ? active : STDOUT;
  }
}
