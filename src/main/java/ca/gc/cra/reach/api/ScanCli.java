package ca.gc.cra.reach.api;

import ca.gc.cra.reach.application.port.ResultSinkPort;
import ca.gc.cra.reach.config.CompositionRoot;
import ca.gc.cra.reach.config.DefaultsForMode;
import ca.gc.cra.reach.config.ScanConfig;
import ca.gc.cra.reach.domain.ScanSpecException;
import ca.gc.cra.reach.domain.scan.ScanPlan;
import ca.gc.cra.reach.domain.scan.ScanReport;
import ca.gc.cra.reach.domain.target.TargetExpander;
import ca.gc.cra.reach.infrastructure.persistence.ResultSinks;
import ca.gc.cra.reach.logging.LoggingConfigurator;
import ca.gc.cra.reach.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code scan} command: resolves targets and ports, runs the scan, and renders results.
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final int MAX_LOGGED_VALUE = 128;
  private static final String SUMMARY_USAGE =
      "usage: reach scan (cidr=BLOCK|hostsFile=PATH|start=IP end=IP|host=HOST) ports=SPEC "
          + "[timeout=SECONDS] [workers=N] [out=FILE.csv|FILE.json] [config=PATH] "
          + "[--ping-first] [--no-print] [--dry-run]";
  private static final String HELP_TEXT = """
      REACH TCP reachability scan

      Usage:
        reach scan <target> ports=SPEC [options]

      Target (exactly one):
        cidr=BLOCK             IPv4 block, e.g. 192.168.1.0/24 (network and broadcast skipped)
        hostsFile=PATH         One host per line; blank lines and # comments ignored
        start=IP end=IP        Inclusive IPv4 range, endpoints in either order
        host=HOST              Single hostname or IP literal

      Ports:
        ports=SPEC             e.g. 22 | 22,80 | 8000-8010 | 22,80,8000-8010; out-of-range values are skipped

      Options:
        timeout=SECONDS        Connect timeout per probe (default 0.5, max 60)
        workers=N              Concurrent probes (default 200, max 5000)
        out=PATH               Write results to .csv or .json instead of the console
        config=PATH            YAML file with common: and scan: sections (CLI wins)
        metricsExporter=otlp|none  OpenTelemetry metrics export (default none)
        otelEndpoint=URL       OTLP gRPC endpoint (default http://localhost:4317)
        --ping-first           Drop hosts that do not answer ping before scanning
        --no-print             Do not print open ports to the console
        --dry-run              Resolve targets and ports, print the plan, probe nothing
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private ScanCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the scan command and returns its exit code.
   *
   * @param args command arguments (without the command word)
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for scan CLI");
    }

    ScanConfig config;
    ScanPlan plan;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveOptions(DefaultsForMode.SCAN, input, SUMMARY_USAGE);
      config = parseConfig(effective);
      plan = resolvePlan(config);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    if (config.dryRun()) {
      return printDryRunPlan(config, plan);
    }
    return execute(config, plan);
  }

  private static ScanConfig parseConfig(Map<String, String> effective) throws CliAbort {
    try {
      return ScanConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid scan arguments: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_VALUE * 2));
      ConfigCliUtils.printUsage(SUMMARY_USAGE);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static ScanPlan resolvePlan(ScanConfig config) throws CliAbort {
    List<String> hosts;
    try {
      hosts = TargetExpander.expand(config.target());
    } catch (ScanSpecException ex) {
      log.error("Invalid target: {}", Logs.truncate(ex.getMessage(), MAX_LOGGED_VALUE * 2));
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    log.info("Resolved {} to {} hosts and {} ports",
        Logs.truncate(config.target().describe(), MAX_LOGGED_VALUE), hosts.size(), config.ports().size());
    return new ScanPlan(hosts, config.ports(), config.timeout(), config.workers(), config.pingFirst());
  }

  private static ExitCode printDryRunPlan(ScanConfig config, ScanPlan plan) {
    try {
      config.output().ifPresent(ResultSinks::forPath);
    } catch (ScanSpecException ex) {
      log.error(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    List<String> lines = new ArrayList<>();
    lines.add("Scan dry-run: no probes will be sent.");
    lines.add(" Target           : " + config.target().describe());
    lines.add(" Hosts            : " + plan.hosts().size() + sample(plan.hosts()));
    lines.add(" Ports            : " + plan.ports().size() + " (" + abbreviate(plan.ports().toSpec()) + ")");
    lines.add(" Probes (max)     : " + plan.maxTasks());
    lines.add(" Timeout          : " + plan.timeout().toMillis() + " ms");
    lines.add(" Workers          : " + plan.workers());
    lines.add(" Ping first       : " + plan.pingFirst());
    lines.add(" Output           : " + config.output().map(Path::toString).orElse("<console>"));
    lines.add(" Metrics exporter : " + config.telemetry().exporter().name().toLowerCase(Locale.ROOT));
    lines.add(" Re-run without --dry-run to scan.");
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }

  private static ExitCode execute(ScanConfig config, ScanPlan plan) {
    try (CompositionRoot root = new CompositionRoot(config, CliPrinter::println)) {
      ScanReport report = root.scanUseCase().execute(plan);
      CliPrinter.println(String.format(Locale.ROOT,
          "Scanned %d hosts x %d ports (%d probes) in %d ms: %d open",
          report.probedHosts(), report.portCount(), report.totalTasks(),
          report.elapsedMillis(), report.openCount()));
      return writeResults(root, config, report);
    } catch (ScanSpecException ex) {
      log.error("Scan rejected: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Scan interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode writeResults(CompositionRoot root, ScanConfig config, ScanReport report) {
    Optional<Path> output = config.output();
    if (output.isEmpty() && !config.printOpen()) {
      log.info("Console listing suppressed (--no-print); {} open pairs", report.openCount());
      return ExitCode.SUCCESS;
    }
    ResultSinkPort sink;
    try {
      sink = root.resultSink();
    } catch (ScanSpecException ex) {
      log.error(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    try {
      sink.write(report.openPairs());
    } catch (IOException ex) {
      log.error("Failed to write results to {}", sink.describe(), ex);
      return ExitCode.IO_ERROR;
    }
    output.ifPresent(path ->
        CliPrinter.println("Saved " + report.openCount() + " open pairs to " + path));
    return ExitCode.SUCCESS;
  }

  private static String sample(List<String> hosts) {
    if (hosts.isEmpty()) {
      return "";
    }
    String first = Logs.truncate(hosts.get(0), MAX_LOGGED_VALUE);
    if (hosts.size() == 1) {
      return " (" + first + ")";
    }
    return " (" + first + " .. " + Logs.truncate(hosts.get(hosts.size() - 1), MAX_LOGGED_VALUE) + ")";
  }

  private static String abbreviate(String spec) {
    return spec.length() <= MAX_LOGGED_VALUE ? spec : spec.substring(0, MAX_LOGGED_VALUE) + "...";
  }
}
