package ca.gc.cra.reach.domain.scan;

import java.util.Objects;

/**
 * Immutable (host, port) pair describing one TCP connect attempt. Task identity is the pair itself.
 *
 * @param host hostname or IP literal
 * @param port TCP port in {@code [1, 65535]}
 * @since 0.1.0
 */
public record ProbeTask(String host, int port) {
  public ProbeTask {
    Objects.requireNonNull(host, "host");
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("port must be between 1 and 65535 (was " + port + ")");
    }
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
