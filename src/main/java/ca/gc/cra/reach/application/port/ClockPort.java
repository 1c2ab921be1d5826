package ca.gc.cra.reach.application.port;

/**
 * <strong>What:</strong> Port supplying a monotonic time source for scan duration measurement.
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.reach.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds; only differences are meaningful.
   *
   * @return nanosecond timestamp
   */
  long nanoTime();
}
