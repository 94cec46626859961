package dev.ito.domain.audit;

import java.util.Objects;

/**
 * Correlation fields attached to every audit event.
 *
 * @param sessionId process-group session identifier; never blank
 * @param harnessSessionId session id of the driving assistant harness; may be {@code null}
 * @param branch git branch at write time; may be {@code null}
 * @param worktree worktree name when not the main worktree; may be {@code null}
 * @param commit short commit hash of HEAD; may be {@code null}
 * @since 0.1.0
 */
public record EventContext(
    String sessionId, String harnessSessionId, String branch, String worktree, String commit) {

  public EventContext {
    Objects.requireNonNull(sessionId, "sessionId");
    if (sessionId.isBlank()) {
      throw new IllegalArgumentException("sessionId must not be blank");
    }
  }

  /**
   * Context carrying only a session id.
   *
   * @param sessionId session identifier
   * @return context without git or harness details
   */
  public static EventContext ofSession(String sessionId) {
    return new EventContext(sessionId, null, null, null, null);
  }
}
