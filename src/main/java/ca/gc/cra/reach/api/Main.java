package ca.gc.cra.reach.api;

import ca.gc.cra.reach.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REACH CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: reach <scan|targets> [options]";
  private static final String HELP_TEXT = """
      REACH concurrent TCP reachability scanner

      Usage:
        reach <command> [options]

      Commands:
        scan        Probe host x port pairs for open TCP ports (scan --help for details)
        targets     Print the hosts a target selection expands to

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare word is the command
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.command().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = input.command().get();
    String[] delegateArgs = withoutCommand(args, command);
    return switch (command) {
      case "scan" -> ScanCli.run(delegateArgs);
      case "targets" -> TargetsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutCommand(String[] args, String command) {
    List<String> rest = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().toLowerCase(Locale.ROOT).equals(command)) {
        removed = true;
        continue;
      }
      rest.add(arg);
    }
    return rest.toArray(String[]::new);
  }
}
