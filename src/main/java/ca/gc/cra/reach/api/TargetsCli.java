package ca.gc.cra.reach.api;

import ca.gc.cra.reach.config.DefaultsForMode;
import ca.gc.cra.reach.config.ScanConfig;
import ca.gc.cra.reach.domain.ScanSpecException;
import ca.gc.cra.reach.domain.target.HostSpec;
import ca.gc.cra.reach.domain.target.TargetExpander;
import ca.gc.cra.reach.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code targets} command: prints the expanded host list, one host per line, without probing.
 *
 * @since 0.1.0
 */
public final class TargetsCli {
  private static final Logger log = LoggerFactory.getLogger(TargetsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: reach targets (cidr=BLOCK|hostsFile=PATH|start=IP end=IP|host=HOST) [config=PATH]";
  private static final String HELP_TEXT = """
      REACH target preview

      Usage:
        reach targets <target> [config=PATH]

      Prints every host the scan command would probe, in scan order.

      Target (exactly one):
        cidr=BLOCK             IPv4 block, e.g. 10.0.0.0/30
        hostsFile=PATH         One host per line; blank lines and # comments ignored
        start=IP end=IP        Inclusive IPv4 range
        host=HOST              Single hostname or IP literal
      """;

  private TargetsCli() {}

  /**
   * Executes the targets command.
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
    }

    HostSpec target;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveOptions(DefaultsForMode.TARGETS, input, SUMMARY_USAGE);
      target = ScanConfig.targetFromMap(effective);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid target arguments: {}", ex.getMessage());
      ConfigCliUtils.printUsage(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> hosts;
    try {
      hosts = TargetExpander.expand(target);
    } catch (ScanSpecException ex) {
      log.error("Invalid target: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    CliPrinter.printLines(hosts);
    log.info("{} expands to {} hosts", target.describe(), hosts.size());
    return ExitCode.SUCCESS;
  }
}
