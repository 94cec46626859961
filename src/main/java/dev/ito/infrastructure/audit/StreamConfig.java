package dev.ito.infrastructure.audit;

import dev.ito.domain.audit.StreamCursor;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for a tailing session.
 *
 * @param pollInterval delay between polls issued by the caller's loop
 * @param allWorktrees follow every worktree's log instead of only the current one
 * @param last number of initial events to emit; {@code 0} emits all of them
 * @param startCursor resume position persisted by an earlier session
 * @since 0.1.0
 */
public record StreamConfig(
    Duration pollInterval, boolean allWorktrees, int last, Optional<StreamCursor> startCursor) {
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
  public static final int DEFAULT_LAST = 10;

  public StreamConfig {
    Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    if (last < 0) {
      throw new IllegalArgumentException("last must not be negative");
    }
    startCursor = startCursor == null ? Optional.empty() : startCursor;
  }

  public static StreamConfig defaults() {
    return new StreamConfig(DEFAULT_POLL_INTERVAL, false, DEFAULT_LAST, Optional.empty());
  }

  public StreamConfig withStartCursor(StreamCursor cursor) {
    return new StreamConfig(pollInterval, allWorktrees, last, Optional.of(cursor));
  }
}
