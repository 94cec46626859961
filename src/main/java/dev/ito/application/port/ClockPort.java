package dev.ito.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time for audit timestamps.
 * <p><strong>Why:</strong> Tests pin timestamps to make log contents and aggregation order reproducible.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see dev.ito.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; not guaranteed monotonic
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
