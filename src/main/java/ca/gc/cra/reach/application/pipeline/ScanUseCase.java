package ca.gc.cra.reach.application.pipeline;

import ca.gc.cra.reach.application.port.ClockPort;
import ca.gc.cra.reach.application.port.MetricsPort;
import ca.gc.cra.reach.domain.scan.ScanPlan;
import ca.gc.cra.reach.domain.scan.ScanReport;
import ca.gc.cra.reach.domain.scan.ScanRun;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a resolved {@link ScanPlan}: optional liveness prefilter, then the port scan.
 *
 * <p>The phases run sequentially; the prefilter completes before any port is probed. Result rendering is left
 * to the caller so an unsupported destination can be reported after the scan.</p>
 *
 * @since 0.1.0
 */
public final class ScanUseCase {
  private static final Logger log = LoggerFactory.getLogger(ScanUseCase.class);

  private final LivenessPrefilter prefilter;
  private final ScanEngine engine;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param prefilter liveness phase, used only when the plan asks for it
   * @param engine port scan phase
   * @param metrics receives {@code scan.duration.ms} and {@code scan.tasks.total}
   * @param clock monotonic clock for the elapsed time
   */
  public ScanUseCase(LivenessPrefilter prefilter, ScanEngine engine, MetricsPort metrics, ClockPort clock) {
    this.prefilter = Objects.requireNonNull(prefilter, "prefilter");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes the plan and summarizes the run.
   *
   * @param plan resolved hosts, ports and settings
   * @return report with open pairs sorted by host then port
   * @throws InterruptedException if interrupted during either phase
   */
  public ScanReport execute(ScanPlan plan) throws InterruptedException {
    Objects.requireNonNull(plan, "plan");
    long start = clock.nanoTime();

    List<String> hosts = plan.hosts();
    if (plan.pingFirst()) {
      hosts = prefilter.filter(
          hosts, LivenessPrefilter.pingTimeoutFor(plan.timeout()), plan.workers());
      if (hosts.isEmpty()) {
        log.warn("No hosts answered the liveness probe; nothing to scan");
      }
    }

    ScanRun run = engine.scan(hosts, plan.ports(), plan.timeout(), plan.workers());
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(clock.nanoTime() - start);
    metrics.observe("scan.duration.ms", elapsedMillis);
    metrics.observe("scan.tasks.total", run.totalTasks());

    ScanReport report = new ScanReport(
        plan.hosts().size(),
        hosts.size(),
        plan.ports().size(),
        run.totalTasks(),
        run.completed(),
        run.openPairs(),
        elapsedMillis);
    log.info("Run finished in {} ms: {} open pairs", elapsedMillis, report.openCount());
    return report;
  }
}
