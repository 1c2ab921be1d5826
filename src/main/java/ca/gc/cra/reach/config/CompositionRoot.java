package ca.gc.cra.reach.config;

import ca.gc.cra.reach.application.pipeline.LivenessPrefilter;
import ca.gc.cra.reach.application.pipeline.ScanEngine;
import ca.gc.cra.reach.application.pipeline.ScanUseCase;
import ca.gc.cra.reach.application.port.ClockPort;
import ca.gc.cra.reach.application.port.LivenessProbePort;
import ca.gc.cra.reach.application.port.OpenPairListener;
import ca.gc.cra.reach.application.port.ResultSinkPort;
import ca.gc.cra.reach.application.port.ScanProgressListener;
import ca.gc.cra.reach.application.port.TcpProbePort;
import ca.gc.cra.reach.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.reach.infrastructure.net.PingLivenessProbe;
import ca.gc.cra.reach.infrastructure.net.SocketTcpProbe;
import ca.gc.cra.reach.infrastructure.persistence.ConsoleResultSink;
import ca.gc.cra.reach.infrastructure.persistence.ResultSinks;
import ca.gc.cra.reach.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.reach.logging.LoggingProgressListener;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Composition root that wires the scan use case to concrete adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the socket probe, ping probe, clock and OpenTelemetry metrics adapter.</li>
 *   <li>Build the prefilter, engine and use case graph for one {@link ScanConfig}.</li>
 *   <li>Select the result sink from the configured destination.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Create and use from the CLI thread; the adapters it hands out are thread-safe.</p>
 *
 * @since 0.1.0
 * @see ScanUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private final ScanConfig config;
  private final Consumer<String> console;
  private final TcpProbePort tcpProbe;
  private final LivenessProbePort livenessProbe;
  private final OpenTelemetryMetricsAdapter metrics;
  private final ClockPort clock;

  /**
   * Creates the production wiring.
   *
   * @param config validated scan configuration
   * @param console receives console lines (live open-port lines and console results)
   */
  public CompositionRoot(ScanConfig config, Consumer<String> console) {
    this(config, console, new SocketTcpProbe(), new PingLivenessProbe());
  }

  CompositionRoot(
      ScanConfig config, Consumer<String> console, TcpProbePort tcpProbe, LivenessProbePort livenessProbe) {
    this.config = Objects.requireNonNull(config, "config");
    this.console = Objects.requireNonNull(console, "console");
    this.tcpProbe = Objects.requireNonNull(tcpProbe, "tcpProbe");
    this.livenessProbe = Objects.requireNonNull(livenessProbe, "livenessProbe");
    this.metrics = new OpenTelemetryMetricsAdapter(config.telemetry());
    this.clock = new SystemClockAdapter();
  }

  /**
   * Builds the scan use case with logging progress and, unless disabled, live {@code [+] host:port open} lines.
   *
   * @return use case ready to execute a plan
   */
  public ScanUseCase scanUseCase() {
    ScanProgressListener progress = new LoggingProgressListener();
    OpenPairListener openListener = config.printOpen()
        ? pair -> console.accept("[+] " + pair.host() + ":" + pair.port() + " open")
        : OpenPairListener.NONE;
    LivenessPrefilter prefilter = new LivenessPrefilter(livenessProbe, metrics, progress);
    ScanEngine engine = new ScanEngine(tcpProbe, metrics, progress, openListener);
    return new ScanUseCase(prefilter, engine, metrics, clock);
  }

  /**
   * Returns the sink for the configured destination, or the console sink when none was given.
   *
   * @return result sink
   * @throws ca.gc.cra.reach.infrastructure.persistence.UnsupportedOutputFormatException for an unsupported
   *     file extension
   */
  public ResultSinkPort resultSink() {
    return config.output()
        .map(ResultSinks::forPath)
        .orElseGet(() -> new ConsoleResultSink(console));
  }

  /** Flushes and shuts down the metrics exporter. */
  @Override
  public void close() {
    metrics.close();
  }
}
