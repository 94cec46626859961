package dev.ito.application.port;

import dev.ito.domain.audit.FileState;
import dev.ito.domain.audit.ReconcileInputException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Boundary to the collaborators that parse tracked files into a {@link FileState} snapshot.
 *
 * @since 0.1.0
 */
public interface FileStateSource {
  /**
   * Derives the current observed state.
   *
   * @param itoDir project state directory (usually {@code <project>/.ito})
   * @param changeId restrict to one change; empty scans every active change
   * @return snapshot of observed values
   * @throws ReconcileInputException when a tracked file cannot be read or the change does not exist
   */
  FileState load(Path itoDir, Optional<String> changeId) throws ReconcileInputException;
}
