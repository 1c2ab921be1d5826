package ca.gc.cra.reach.config;

import ca.gc.cra.reach.domain.port.InvalidPortSpecException;
import ca.gc.cra.reach.domain.port.PortSet;
import ca.gc.cra.reach.domain.port.PortSpecParser;
import ca.gc.cra.reach.domain.target.HostSpec;
import ca.gc.cra.reach.domain.target.InvalidTargetSpecException;
import ca.gc.cra.reach.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.reach.validation.Numbers;
import ca.gc.cra.reach.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for the {@code scan} command.
 * <p><strong>Role:</strong> Typed view of the merged CLI/YAML/default map; built once per invocation.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param target selected target source
 * @param ports parsed, non-empty port set
 * @param timeout per-probe connect timeout
 * @param workers scan pool size
 * @param pingFirst run the liveness prefilter first
 * @param output optional result file; empty means console output
 * @param printOpen print {@code [+] host:port open} lines while scanning
 * @param dryRun resolve the plan without probing
 * @param telemetry metrics exporter settings
 * @since 0.1.0
 */
public record ScanConfig(
    HostSpec target,
    PortSet ports,
    Duration timeout,
    int workers,
    boolean pingFirst,
    Optional<Path> output,
    boolean printOpen,
    boolean dryRun,
    TelemetrySettings telemetry) {

  /** Default probe timeout in seconds. */
  public static final double DEFAULT_TIMEOUT_SECONDS = 0.5d;
  /** Largest accepted probe timeout in seconds. */
  public static final double MAX_TIMEOUT_SECONDS = 60d;
  /** Default scan pool size. */
  public static final int DEFAULT_WORKERS = 200;
  /** Largest accepted scan pool size. */
  public static final int MAX_WORKERS = 5_000;

  static final List<String> TARGET_KEYS = List.of("cidr", "hostsFile", "start", "end", "host");

  public ScanConfig {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(ports, "ports");
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param options merged options; see {@link DefaultsForMode} for the key set
   * @return validated configuration
   * @throws InvalidTargetSpecException if the target selection is missing, ambiguous, or malformed
   * @throws InvalidPortSpecException if {@code ports} is missing or malformed
   * @throws ca.gc.cra.reach.domain.port.EmptyPortSpecException if no valid port remains
   * @throws IllegalArgumentException if a numeric or telemetry option is invalid
   */
  public static ScanConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    HostSpec target = targetFromMap(options);

    String portSpec = options.get("ports");
    if (Strings.isBlank(portSpec)) {
      throw new InvalidPortSpecException("ports= is required (e.g. ports=22,80,8000-8010)");
    }
    PortSet ports = PortSpecParser.parseNonEmpty(portSpec);

    double timeoutSeconds = optional(options, "timeout")
        .map(raw -> Numbers.parseDouble("timeout", raw))
        .orElse(DEFAULT_TIMEOUT_SECONDS);
    Numbers.requireAboveAtMost("timeout", timeoutSeconds, 0d, MAX_TIMEOUT_SECONDS);
    Duration timeout = Duration.ofNanos(Math.max(1_000_000L, Math.round(timeoutSeconds * 1_000_000_000d)));

    int workers = optional(options, "workers")
        .map(raw -> Numbers.parseInt("workers", raw))
        .orElse(DEFAULT_WORKERS);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);

    Optional<Path> output = optional(options, "out").map(raw -> parsePath("out", raw));

    return new ScanConfig(
        target,
        ports,
        timeout,
        workers,
        parseBoolean(options.get("pingFirst")),
        output,
        !parseBoolean(options.get("noPrint")),
        parseBoolean(options.get("dryRun")),
        TelemetrySettings.fromMap(options));
  }

  /**
   * Resolves the single target selector among {@code cidr}, {@code hostsFile}, {@code start}+{@code end} and
   * {@code host}.
   *
   * @param options merged options
   * @return selected host specification
   * @throws InvalidTargetSpecException when none, several, or a half range is given
   */
  public static HostSpec targetFromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Optional<String> cidr = optional(options, "cidr");
    Optional<String> hostsFile = optional(options, "hostsFile");
    Optional<String> start = optional(options, "start");
    Optional<String> end = optional(options, "end");
    Optional<String> host = optional(options, "host");

    if (start.isPresent() != end.isPresent()) {
      throw new InvalidTargetSpecException("start= and end= must be given together");
    }

    List<HostSpec> selected = new ArrayList<>(1);
    cidr.ifPresent(value -> selected.add(new HostSpec.Cidr(value)));
    hostsFile.ifPresent(value -> selected.add(new HostSpec.HostsFile(parsePath("hostsFile", value))));
    if (start.isPresent()) {
      selected.add(new HostSpec.Range(start.get(), end.get()));
    }
    host.ifPresent(value -> selected.add(new HostSpec.Single(value)));

    if (selected.isEmpty()) {
      throw new InvalidTargetSpecException(
          "A target is required: cidr=BLOCK, hostsFile=PATH, start=IP end=IP, or host=HOST");
    }
    if (selected.size() > 1) {
      throw new InvalidTargetSpecException(
          "Target options are mutually exclusive; got " + selected.stream().map(HostSpec::describe).toList());
    }
    return selected.get(0);
  }

  private static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static Path parsePath(String name, String raw) {
    Strings.requireNonBlank(name, raw);
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return Path.of(raw);
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
