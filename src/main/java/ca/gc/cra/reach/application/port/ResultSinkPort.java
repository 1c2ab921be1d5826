package ca.gc.cra.reach.application.port;

import ca.gc.cra.reach.domain.scan.OpenPair;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port rendering the final, sorted open pairs of a scan.
 * <p><strong>Role:</strong> Driven port implemented by console, CSV, and JSON adapters.</p>
 * <p><strong>Thread-safety:</strong> Called once per run from the coordinating thread; implementations need not be
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ResultSinkPort {
  /**
   * Writes every pair in the given order.
   *
   * @param openPairs pairs sorted by host then port; may be empty
   * @throws IOException if the destination cannot be written
   */
  void write(List<OpenPair> openPairs) throws IOException;

  /**
   * Describes the destination for logs, e.g. {@code csv:/tmp/result.csv}.
   *
   * @return destination label
   */
  String describe();
}
