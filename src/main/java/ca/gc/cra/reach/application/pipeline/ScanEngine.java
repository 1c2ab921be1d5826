package ca.gc.cra.reach.application.pipeline;

import ca.gc.cra.reach.application.port.MetricsPort;
import ca.gc.cra.reach.application.port.OpenPairListener;
import ca.gc.cra.reach.application.port.ScanProgressListener;
import ca.gc.cra.reach.application.port.TcpProbePort;
import ca.gc.cra.reach.domain.ScanSpecException;
import ca.gc.cra.reach.domain.port.PortSet;
import ca.gc.cra.reach.domain.scan.OpenPair;
import ca.gc.cra.reach.domain.scan.ProbeResult;
import ca.gc.cra.reach.domain.scan.ProbeTask;
import ca.gc.cra.reach.domain.scan.ScanRun;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Executes every host x port probe task under a fixed-size worker pool.
 * <p><strong>Why:</strong> Probes are I/O bound and mostly blocked on the network, so many run concurrently while
 * the submitting thread is throttled to {@code 2 x workers} in-flight tasks.</p>
 * <p><strong>Role:</strong> Core of the scan use case; sits between the prefilter and the result sinks.</p>
 * <p><strong>Thread-safety:</strong> Each {@link #scan} call owns its pool and {@link ScanRun}; the engine itself
 * holds only immutable collaborators and may be reused sequentially or concurrently.</p>
 * <p><strong>Observability:</strong> Emits {@code scan.probe.open} and {@code scan.probe.closed} counters and
 * reports progress every {@value #PROGRESS_INTERVAL} completions and at the final task.</p>
 *
 * @since 0.1.0
 */
public final class ScanEngine {
  private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

  /** Completions between two progress reports. */
  public static final int PROGRESS_INTERVAL = 100;
  static final String PHASE = "scan";

  private final TcpProbePort probe;
  private final MetricsPort metrics;
  private final ScanProgressListener progress;
  private final OpenPairListener openListener;

  /**
   * Creates an engine.
   *
   * @param probe TCP connect adapter
   * @param metrics metrics sink for probe outcomes
   * @param progress progress observer; use {@link ScanProgressListener#NONE} to ignore
   * @param openListener observer for open pairs as they are found; use {@link OpenPairListener#NONE} to ignore
   */
  public ScanEngine(
      TcpProbePort probe,
      MetricsPort metrics,
      ScanProgressListener progress,
      OpenPairListener openListener) {
    this.probe = Objects.requireNonNull(probe, "probe");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.progress = Objects.requireNonNull(progress, "progress");
    this.openListener = Objects.requireNonNull(openListener, "openListener");
  }

  /**
   * Probes every (host, port) combination exactly once and waits for all of them to finish.
   *
   * @param targets hosts to probe, in target order; duplicates are probed once
   * @param ports ports probed on each host
   * @param timeout per-probe connect timeout
   * @param workers pool size; at least one
   * @return completed run; {@link ScanRun#openPairs()} is sorted by host then port
   * @throws InterruptedException if interrupted while submitting or waiting; the pool is shut down
   * @throws ScanSpecException if the task universe does not fit in an {@code int}
   */
  public ScanRun scan(List<String> targets, PortSet ports, Duration timeout, int workers)
      throws InterruptedException {
    // duplicate host lines would otherwise repeat tasks
    Set<String> hosts = new LinkedHashSet<>(Objects.requireNonNull(targets, "targets"));
    Objects.requireNonNull(ports, "ports");
    Objects.requireNonNull(timeout, "timeout");
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    long universe = (long) hosts.size() * ports.size();
    if (universe > Integer.MAX_VALUE) {
      throw new ScanSpecException(
          "Too many probe tasks: " + hosts.size() + " hosts x " + ports.size() + " ports");
    }
    int total = (int) universe;
    ScanRun run = new ScanRun(total);
    if (total == 0) {
      log.info("Nothing to scan ({} hosts, {} ports)", hosts.size(), ports.size());
      return run;
    }

    int poolSize = Math.min(workers, total);
    log.info("Scanning {} hosts x {} ports = {} probes with {} workers (timeout {} ms)",
        hosts.size(), ports.size(), total, poolSize, timeout.toMillis());
    int[] portNumbers = ports.toArray();
    try (BoundedPhase phase = new BoundedPhase(PHASE, poolSize, poolSize * 2)) {
      for (String host : hosts) {
        for (int port : portNumbers) {
          ProbeTask task = new ProbeTask(host, port);
          phase.submit(() -> execute(task, timeout, run));
        }
      }
      phase.awaitCompletion();
    }
    if (!run.isComplete()) {
      throw new IllegalStateException(
          "scan finished with " + run.completed() + " of " + total + " probes recorded");
    }
    List<OpenPair> open = run.openPairs();
    log.info("Scan complete: {} open of {} probes", open.size(), total);
    return run;
  }

  private void execute(ProbeTask task, Duration timeout, ScanRun run) {
    ProbeResult result;
    try {
      result = probe.probe(task, timeout);
    } catch (RuntimeException ex) {
      log.debug("Probe {} threw; treating as not open", task, ex);
      result = ProbeResult.notOpen(task);
    }
    if (result == null) {
      result = ProbeResult.notOpen(task);
    }
    int done = run.record(result);
    if (result.isOpen()) {
      metrics.increment("scan.probe.open");
      notifyOpen(OpenPair.of(task));
    } else {
      metrics.increment("scan.probe.closed");
    }
    if (done % PROGRESS_INTERVAL == 0 || done == run.totalTasks()) {
      notifyProgress(done, run.totalTasks());
    }
  }

  private void notifyOpen(OpenPair pair) {
    try {
      openListener.onOpen(pair);
    } catch (RuntimeException ex) {
      log.warn("Open-pair listener failed for {}", pair, ex);
    }
  }

  private void notifyProgress(int done, int total) {
    try {
      progress.onProgress(PHASE, done, total);
    } catch (RuntimeException ex) {
      log.warn("Progress listener failed at {}/{}", done, total, ex);
    }
  }
}
