package dev.ito.infrastructure.audit;

import dev.ito.domain.audit.LineIssue;
import dev.ito.domain.audit.StreamCursor;
import dev.ito.domain.audit.StreamEvent;
import java.util.List;
import java.util.Objects;

/**
 * Events returned by one read of the stream watcher.
 *
 * @param events new events in file order
 * @param cursor position to pass to the next poll
 * @param issues lines skipped during this read
 * @param resynced whether the previous cursor was stale and the log was re-read from the start
 * @since 0.1.0
 */
public record StreamBatch(
    List<StreamEvent> events, StreamCursor cursor, List<LineIssue> issues, boolean resynced) {
  public StreamBatch {
    events = List.copyOf(Objects.requireNonNull(events, "events"));
    Objects.requireNonNull(cursor, "cursor");
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }
}
