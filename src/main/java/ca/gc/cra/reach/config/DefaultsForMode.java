package ca.gc.cra.reach.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each REACH command.
 *
 * <p>Target selectors and {@code ports} have no defaults; they must come from the CLI or YAML.</p>
 */
public final class DefaultsForMode {
  /** Mode name of the {@code scan} command. */
  public static final String SCAN = "scan";
  /** Mode name of the {@code targets} command. */
  public static final String TARGETS = "targets";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode command name ({@code scan} or {@code targets})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case SCAN -> buildScanDefaults();
      case TARGETS -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildScanDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("timeout", Double.toString(ScanConfig.DEFAULT_TIMEOUT_SECONDS));
    map.put("workers", Integer.toString(ScanConfig.DEFAULT_WORKERS));
    map.put("pingFirst", "false");
    map.put("noPrint", "false");
    map.put("dryRun", "false");
    map.put("out", "");
    return map;
  }
}
