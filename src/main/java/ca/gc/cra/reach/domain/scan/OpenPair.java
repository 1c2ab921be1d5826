package ca.gc.cra.reach.domain.scan;

import java.util.Comparator;
import java.util.Objects;

/**
 * A (host, port) combination confirmed to accept a TCP connection.
 *
 * <p>Natural order is host (lexicographic string order) then port (numeric), which is the presentation
 * order of every result sink.</p>
 *
 * @param host hostname or IP literal as it appeared in the target list
 * @param port open TCP port
 * @since 0.1.0
 */
public record OpenPair(String host, int port) implements Comparable<OpenPair> {
  private static final Comparator<OpenPair> ORDER =
      Comparator.comparing(OpenPair::host).thenComparingInt(OpenPair::port);

  public OpenPair {
    Objects.requireNonNull(host, "host");
  }

  /**
   * Creates the open pair for a probe task.
   *
   * @param task probed task
   * @return matching pair
   */
  public static OpenPair of(ProbeTask task) {
    return new OpenPair(task.host(), task.port());
  }

  @Override
  public int compareTo(OpenPair other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
