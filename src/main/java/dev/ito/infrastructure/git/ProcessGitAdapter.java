package dev.ito.infrastructure.git;

import dev.ito.application.port.GitPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GitPort} that launches the {@code git} executable.
 *
 * <p>Output is redirected to temporary files so a chatty command cannot block on a full pipe; the process is
 * destroyed when it exceeds the timeout.</p>
 *
 * @since 0.1.0
 */
public final class ProcessGitAdapter implements GitPort {
  private static final Logger log = LoggerFactory.getLogger(ProcessGitAdapter.class);
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final String executable;
  private final Duration timeout;

  public ProcessGitAdapter() {
    this("git", DEFAULT_TIMEOUT);
  }

  public ProcessGitAdapter(String executable, Duration timeout) {
    this.executable = Objects.requireNonNull(executable, "executable");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public Result run(Path workingDir, List<String> args) throws IOException {
    Objects.requireNonNull(workingDir, "workingDir");
    List<String> command = new ArrayList<>(args.size() + 1);
    command.add(executable);
    command.addAll(args);

    Path stdout = Files.createTempFile("ito-git-", ".out");
    Path stderr = Files.createTempFile("ito-git-", ".err");
    try {
      Process process = new ProcessBuilder(command)
          .directory(workingDir.toFile())
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile())
          .start();
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new IOException("git " + String.join(" ", args) + " timed out after " + timeout);
      }
      Result result = new Result(
          process.exitValue(),
          Files.readString(stdout, StandardCharsets.UTF_8),
          Files.readString(stderr, StandardCharsets.UTF_8));
      log.debug("git {} in {} exited with {}", args, workingDir, result.exitCode());
      return result;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while running git " + String.join(" ", args), ex);
    } finally {
      Files.deleteIfExists(stdout);
      Files.deleteIfExists(stderr);
    }
  }
}
