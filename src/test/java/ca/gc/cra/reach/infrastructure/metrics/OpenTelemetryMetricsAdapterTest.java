package ca.gc.cra.reach.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterUnderDottedName() {
    adapter.increment("scan.probe.open");
    adapter.increment("scan.probe.open");
    adapter.increment("scan.probe.closed");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData open = find(metrics, "scan.probe.open").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, open.getType());
    LongPointData point = open.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, open.getInstrumentationScopeInfo().getName());

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("reach", open.getResource().getAttribute(serviceName));
    AttributeKey<String> serviceNamespace = AttributeKey.stringKey("service.namespace");
    assertEquals("ca.gc.cra", open.getResource().getAttribute(serviceNamespace));

    assertTrue(find(metrics, "scan.probe.closed").isPresent());
  }

  @Test
  void observeRecordsHistogramWithMillisecondUnit() {
    adapter.observe("scan.duration.ms", 120);
    adapter.observe("scan.duration.ms", 80);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "scan.duration.ms").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum(), 0.0001);
  }

  @Test
  void testingBootstrapExports() {
    assertTrue(adapter.isExporting());
  }

  @Test
  void disabledSettingsUseNoopMeter() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled())) {
      noop.increment("scan.probe.open");
      noop.observe("scan.duration.ms", 5);
      assertFalse(noop.isExporting());
    }
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
