package ca.gc.cra.reach.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {
  private static final UnaryOperator<String> NO_ENV = name -> null;

  @Test
  void defaultsToNoExport() {
    TelemetrySettings settings = TelemetrySettings.fromMap(Map.of(), NO_ENV);

    assertEquals(TelemetrySettings.Exporter.NONE, settings.exporter());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals("", settings.resourceAttributes());
  }

  @Test
  void configurationKeysWinOverEnvironment() {
    Map<String, String> env = Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://env-collector:4317");

    TelemetrySettings settings = TelemetrySettings.fromMap(
        Map.of("metricsExporter", "OTLP", "otelEndpoint", "https://collector.example:4317"), env::get);

    assertEquals(TelemetrySettings.Exporter.OTLP, settings.exporter());
    assertEquals("https://collector.example:4317", settings.endpoint());
  }

  @Test
  void environmentFillsBlankKeys() {
    Map<String, String> env = Map.of(
        "OTEL_METRICS_EXPORTER", "otlp",
        "OTEL_RESOURCE_ATTRIBUTES", "deployment.environment=lab");

    TelemetrySettings settings = TelemetrySettings.fromMap(
        Map.of("metricsExporter", "", "otelResourceAttributes", " "), env::get);

    assertEquals(TelemetrySettings.Exporter.OTLP, settings.exporter());
    assertEquals("deployment.environment=lab", settings.resourceAttributes());
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetrySettings.fromMap(Map.of("metricsExporter", "prometheus"), NO_ENV));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetrySettings.fromMap(Map.of("otelEndpoint", "ftp://collector:21"), NO_ENV));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetrySettings.fromMap(Map.of("otelEndpoint", "http://"), NO_ENV));
  }

  @Test
  void resourceAttributesAreParsedAndMalformedEntriesSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=netops, broken, site = ott ,=x");

    assertEquals(2, attributes.size());
    assertEquals("netops", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("ott", attributes.get(AttributeKey.stringKey("site")));
  }
}
