package dev.ito.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@code git} subcommands with bounded execution time.
 *
 * @since 0.1.0
 */
public interface GitPort {
  /**
   * Runs {@code git <args>} inside {@code workingDir}.
   *
   * @param workingDir directory the command runs in
   * @param args git arguments, for example {@code worktree list --porcelain}
   * @return exit status and captured output
   * @throws IOException when git cannot be launched or does not finish in time
   */
  Result run(Path workingDir, List<String> args) throws IOException;

  /**
   * Captured outcome of one git invocation.
   *
   * @param exitCode process exit status
   * @param stdout standard output decoded as UTF-8
   * @param stderr standard error decoded as UTF-8
   */
  record Result(int exitCode, String stdout, String stderr) {
    public Result {
      stdout = Objects.requireNonNullElse(stdout, "");
      stderr = Objects.requireNonNullElse(stderr, "");
    }

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
