package ca.gc.cra.reach.application.port;

import java.time.Duration;

/**
 * Port abstracting a best-effort host liveness check (ICMP echo or equivalent).
 *
 * <p>Implementations return {@code false} for any failure, including their own execution errors; the
 * prefilter is an optimization and never fails the run. Must be safe for concurrent calls.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LivenessProbePort {
  /**
   * Checks whether the host answers within the timeout.
   *
   * @param host hostname or IP literal
   * @param timeout answer timeout
   * @return {@code true} when the host answered
   */
  boolean isAlive(String host, Duration timeout);
}
