package ca.gc.cra.reach.application.pipeline;

import ca.gc.cra.reach.application.port.LivenessProbePort;
import ca.gc.cra.reach.application.port.MetricsPort;
import ca.gc.cra.reach.application.port.ScanProgressListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops hosts that do not answer a liveness probe before port scanning starts.
 *
 * <p>Runs its own pool of at most {@value #MAX_WORKERS} workers regardless of the scan worker count, which
 * bounds the number of concurrent ping processes. The result keeps input order and never contains duplicates.
 * A failed or silent probe only removes its host; the phase itself never fails the run.</p>
 *
 * @since 0.1.0
 */
public final class LivenessPrefilter {
  private static final Logger log = LoggerFactory.getLogger(LivenessPrefilter.class);

  /** Upper bound on concurrent liveness probes. */
  public static final int MAX_WORKERS = 200;
  static final String PHASE = "prefilter";

  private final LivenessProbePort liveness;
  private final MetricsPort metrics;
  private final ScanProgressListener progress;

  public LivenessPrefilter(LivenessProbePort liveness, MetricsPort metrics, ScanProgressListener progress) {
    this.liveness = Objects.requireNonNull(liveness, "liveness");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  /**
   * Derives the ping timeout from the TCP timeout: whole seconds, at least one.
   *
   * @param tcpTimeout per-probe TCP timeout
   * @return ping answer timeout
   */
  public static Duration pingTimeoutFor(Duration tcpTimeout) {
    return Duration.ofSeconds(Math.max(1L, tcpTimeout.getSeconds()));
  }

  /**
   * Probes every distinct host and returns those that answered.
   *
   * @param hosts candidate hosts
   * @param timeout answer timeout per host
   * @param workers requested scan worker count; the pool uses {@code min(MAX_WORKERS, workers)}
   * @return alive hosts in input order; possibly empty
   * @throws InterruptedException if interrupted while probing
   */
  public List<String> filter(List<String> hosts, Duration timeout, int workers) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    List<String> candidates = new ArrayList<>(new LinkedHashSet<>(Objects.requireNonNull(hosts, "hosts")));
    if (candidates.isEmpty()) {
      return List.of();
    }
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    int total = candidates.size();
    int poolSize = Math.min(Math.min(MAX_WORKERS, workers), total);
    log.info("Pinging {} hosts with {} workers (timeout {} ms)", total, poolSize, timeout.toMillis());

    Set<Integer> alive = ConcurrentHashMap.newKeySet();
    AtomicInteger completed = new AtomicInteger();
    try (BoundedPhase phase = new BoundedPhase(PHASE, poolSize, poolSize * 2)) {
      for (int i = 0; i < total; i++) {
        int index = i;
        String host = candidates.get(i);
        phase.submit(() -> {
          if (check(host, timeout)) {
            alive.add(index);
            metrics.increment("prefilter.host.alive");
          } else {
            metrics.increment("prefilter.host.silent");
          }
          int done = completed.incrementAndGet();
          if (done % ScanEngine.PROGRESS_INTERVAL == 0 || done == total) {
            reportProgress(done, total);
          }
        });
      }
      phase.awaitCompletion();
    }

    List<String> result = new ArrayList<>(alive.size());
    for (int i = 0; i < total; i++) {
      if (alive.contains(i)) {
        result.add(candidates.get(i));
      }
    }
    log.info("{} of {} hosts answered the liveness probe", result.size(), total);
    return List.copyOf(result);
  }

  private boolean check(String host, Duration timeout) {
    try {
      return liveness.isAlive(host, timeout);
    } catch (RuntimeException ex) {
      log.debug("Liveness probe for {} threw; treating as silent", host, ex);
      return false;
    }
  }

  private void reportProgress(int done, int total) {
    try {
      progress.onProgress(PHASE, done, total);
    } catch (RuntimeException ex) {
      log.warn("Progress listener failed at {}/{}", done, total, ex);
    }
  }
}
