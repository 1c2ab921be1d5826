package ca.gc.cra.reach.application.port;

import ca.gc.cra.reach.domain.scan.ProbeResult;
import ca.gc.cra.reach.domain.scan.ProbeTask;
import java.time.Duration;

/**
 * <strong>What:</strong> Port abstracting a single timeout-bounded TCP connect attempt.
 * <p><strong>Role:</strong> Driven port implemented by socket adapters; called from scan workers.</p>
 * <p><strong>Contract:</strong> Implementations never throw for network failures; every failure category maps to
 * {@link ca.gc.cra.reach.domain.scan.ProbeOutcome#NOT_OPEN}. The call must return within roughly
 * {@code timeout} so one slow host cannot stall its worker indefinitely.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent calls from many workers.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TcpProbePort {
  /**
   * Attempts a TCP handshake with the task's host and port.
   *
   * @param task pair to probe
   * @param timeout connect timeout; positive
   * @return probe result, never {@code null}
   */
  ProbeResult probe(ProbeTask task, Duration timeout);
}
