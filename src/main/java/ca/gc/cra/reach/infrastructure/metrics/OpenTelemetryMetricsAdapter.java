package ca.gc.cra.reach.infrastructure.metrics;

import ca.gc.cra.reach.application.port.MetricsPort;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link MetricsPort} adapter forwarding probe counters and run observations to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key and cached; the dotted keys ({@code scan.probe.open}) are valid
 * OpenTelemetry instrument names and are used as-is. With {@code metricsExporter=none} the meter is the API noop
 * meter and every update is discarded.</p>
 *
 * <p>Thread-safe. Close once at the end of the run to flush pending exports.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the given exporter settings.
   *
   * @param settings exporter selection
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1);
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value);
  }

  boolean isExporting() {
    return !bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(key)
        .setUnit("1")
        .setDescription("REACH counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(key)
        .ofLongs()
        .setUnit(key.endsWith(".ms") ? "ms" : "1")
        .setDescription("REACH observation for " + key)
        .build();
  }
}
