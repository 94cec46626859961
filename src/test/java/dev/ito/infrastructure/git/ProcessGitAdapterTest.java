package dev.ito.infrastructure.git;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ito.application.port.GitPort;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessGitAdapterTest {
  @TempDir Path dir;

  @Test
  void missingExecutableRaisesIOException() {
    ProcessGitAdapter adapter = new ProcessGitAdapter(dir.resolve("no-such-git").toString(), Duration.ofSeconds(5));

    assertThrows(IOException.class, () -> adapter.run(dir, List.of("status")));
  }

  @Test
  void exitStatusIsReported() throws Exception {
    GitPort.Result ok = new ProcessGitAdapter("true", Duration.ofSeconds(5)).run(dir, List.of("status"));
    GitPort.Result failed = new ProcessGitAdapter("false", Duration.ofSeconds(5)).run(dir, List.of("status"));

    assertTrue(ok.succeeded());
    assertEquals("", ok.stdout());
    assertFalse(failed.succeeded());
  }
}
