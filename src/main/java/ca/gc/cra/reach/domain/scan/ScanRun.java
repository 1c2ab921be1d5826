package ca.gc.cra.reach.domain.scan;

import java.util.List;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> In-memory aggregate for one scan invocation.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count completed probes (monotonic; progress reporting only).</li>
 *   <li>Collect open pairs without duplicates regardless of completion order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@link #record(ProbeResult)} calls from pool workers; each
 * call performs one atomic increment and at most one concurrent-set insert.</p>
 *
 * @since 0.1.0
 */
public final class ScanRun {
  private final int totalTasks;
  private final AtomicInteger completed = new AtomicInteger();
  private final ConcurrentSkipListSet<OpenPair> openPairs = new ConcurrentSkipListSet<>();

  /**
   * Creates an aggregate for a fixed task universe.
   *
   * @param totalTasks number of probe tasks the run will execute; non-negative
   */
  public ScanRun(int totalTasks) {
    if (totalTasks < 0) {
      throw new IllegalArgumentException("totalTasks must not be negative (was " + totalTasks + ")");
    }
    this.totalTasks = totalTasks;
  }

  /**
   * Records one completed probe.
   *
   * @param result probe result
   * @return completed count after this result, in {@code [1, totalTasks]}
   * @throws IllegalStateException if more results are recorded than tasks exist
   */
  public int record(ProbeResult result) {
    if (result.isOpen()) {
      openPairs.add(OpenPair.of(result.task()));
    }
    int done = completed.incrementAndGet();
    if (done > totalTasks) {
      throw new IllegalStateException("recorded " + done + " results for " + totalTasks + " tasks");
    }
    return done;
  }

  public int totalTasks() {
    return totalTasks;
  }

  public int completed() {
    return completed.get();
  }

  /**
   * Returns {@code true} once every task has reported.
   *
   * @return whether the run is complete
   */
  public boolean isComplete() {
    return completed.get() == totalTasks;
  }

  /**
   * Returns a sorted snapshot of the open pairs found so far.
   *
   * @return immutable list ordered by host then port
   */
  public List<OpenPair> openPairs() {
    return List.copyOf(openPairs);
  }
}
