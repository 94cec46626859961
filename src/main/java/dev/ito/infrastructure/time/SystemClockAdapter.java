package dev.ito.infrastructure.time;

import dev.ito.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
