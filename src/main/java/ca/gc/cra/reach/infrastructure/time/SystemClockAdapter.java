package ca.gc.cra.reach.infrastructure.time;

import ca.gc.cra.reach.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the JVM's monotonic nanosecond counter.
   *
   * @return current nanosecond timestamp
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
