package ca.gc.cra.reach.domain.scan;

import ca.gc.cra.reach.domain.port.PortSet;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Resolved inputs of one scan: the expanded host list, the port set, and execution settings.
 *
 * @param hosts expanded hosts in target order
 * @param ports ports probed on every host
 * @param timeout per-probe connect timeout
 * @param workers scan pool size
 * @param pingFirst whether the liveness prefilter runs before port probing
 * @since 0.1.0
 */
public record ScanPlan(List<String> hosts, PortSet ports, Duration timeout, int workers, boolean pingFirst) {
  public ScanPlan {
    hosts = List.copyOf(Objects.requireNonNull(hosts, "hosts"));
    Objects.requireNonNull(ports, "ports");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive (was " + timeout + ")");
    }
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
  }

  /**
   * Upper bound of probe tasks, assuming every host survives the prefilter.
   *
   * @return {@code hosts x ports}
   */
  public long maxTasks() {
    return (long) hosts.size() * ports.size();
  }
}
