package ca.gc.cra.reach.api;

import ca.gc.cra.reach.config.ConfigMerger;
import ca.gc.cra.reach.config.DefaultsForMode;
import ca.gc.cra.reach.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared steps of the REACH commands: argument parsing, YAML loading, and the precedence merge.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Produces the effective option map for a command.
   *
   * @param mode command name used for defaults and the YAML section
   * @param input parsed command line
   * @param usage one-line usage printed with argument errors
   * @return merged options, CLI over YAML over defaults
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS} or {@link ExitCode#IO_ERROR} after logging the cause
   */
  static Map<String, String> effectiveOptions(String mode, CliInput input, String usage) throws CliAbort {
    List<String> unexpected = new ArrayList<>();
    input.command().ifPresent(unexpected::add);
    unexpected.addAll(input.positionals());
    if (!unexpected.isEmpty()) {
      return fail("Unexpected arguments: " + unexpected, usage);
    }
    if (!input.unknownFlags().isEmpty()) {
      return fail("Unknown flags: " + input.unknownFlags(), usage);
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      return fail("Invalid argument: " + ex.getMessage(), usage);
    }
    cliKv.putAll(input.flagOptions());

    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYamlConfig(configPath, mode, usage);
    try {
      return ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      return fail("Invalid " + mode + " configuration: " + ex.getMessage(), usage);
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  static void printUsage(String usage) {
    CliPrinter.println(usage);
  }

  private static Optional<Map<String, String>> loadYamlConfig(String configPath, String mode, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      fail("Configuration file does not exist: " + yamlPath, usage);
    }
    try {
      Optional<Map<String, String>> loaded = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} keys from {}", loaded.map(Map::size).orElse(0), yamlPath);
      return loaded;
    } catch (IllegalArgumentException ex) {
      return fail("Invalid YAML configuration: " + ex.getMessage(), usage);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static <T> T fail(String message, String usage) throws CliAbort {
    log.error(message);
    printUsage(usage);
    throw new CliAbort(ExitCode.INVALID_ARGS);
  }
}
