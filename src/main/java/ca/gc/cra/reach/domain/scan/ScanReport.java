package ca.gc.cra.reach.domain.scan;

import java.util.List;
import java.util.Objects;

/**
 * Immutable summary of a finished scan.
 *
 * @param requestedHosts hosts produced by target expansion
 * @param probedHosts hosts left after the optional liveness prefilter
 * @param portCount ports probed per host
 * @param totalTasks size of the probe task universe ({@code probedHosts x portCount})
 * @param completedTasks probes that reported; equals {@code totalTasks} for a finished scan
 * @param openPairs open pairs sorted by host then port
 * @param elapsedMillis wall-clock duration of prefilter plus scan
 * @since 0.1.0
 */
public record ScanReport(
    int requestedHosts,
    int probedHosts,
    int portCount,
    int totalTasks,
    int completedTasks,
    List<OpenPair> openPairs,
    long elapsedMillis) {

  public ScanReport {
    Objects.requireNonNull(openPairs, "openPairs");
    openPairs = List.copyOf(openPairs);
  }

  public int openCount() {
    return openPairs.size();
  }
}
