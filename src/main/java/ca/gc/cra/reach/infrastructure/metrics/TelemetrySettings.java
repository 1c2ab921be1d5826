package ca.gc.cra.reach.infrastructure.metrics;

import ca.gc.cra.reach.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Metrics exporter selection resolved from configuration keys, falling back to the standard
 * {@code OTEL_*} environment variables.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes in {@code k=v,k=v} form; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes;
  }

  /**
   * Settings that disable metric export.
   *
   * @return noop settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT, "");
  }

  /**
   * Resolves settings from {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param values merged configuration values
   * @return validated settings
   * @throws IllegalArgumentException if a value is malformed
   */
  public static TelemetrySettings fromMap(Map<String, String> values) {
    return fromMap(values, System::getenv);
  }

  static TelemetrySettings fromMap(Map<String, String> values, UnaryOperator<String> env) {
    Objects.requireNonNull(values, "values");
    String exporterRaw = firstNonBlank(values.get("metricsExporter"), env.apply("OTEL_METRICS_EXPORTER"), "none");
    Exporter exporter = Exporter.parse(exporterRaw);

    String endpoint = firstNonBlank(
        values.get("otelEndpoint"), env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
    validateEndpoint(endpoint);

    String attributes = firstNonBlank(
        values.get("otelResourceAttributes"), env.apply("OTEL_RESOURCE_ATTRIBUTES"), "");
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return new TelemetrySettings(exporter, endpoint, attributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  /** Metric exporter modes. */
  public enum Exporter {
    OTLP,
    NONE;

    static Exporter parse(String raw) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + raw + "')");
      };
    }
  }
}
