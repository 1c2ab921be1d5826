package ca.gc.cra.reach.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 *
 * <p>Target selectors are replaced as a group: when the CLI names any of {@code cidr}, {@code hostsFile},
 * {@code start}, {@code end} or {@code host}, every target selector from YAML is dropped, so a YAML
 * {@code cidr} never collides with a CLI {@code host}.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param mode active command ({@code scan} or {@code targets})
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key, or for suspicious combinations
   * @return immutable merged configuration map
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnings = warn == null ? message -> {} : warn;
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = new LinkedHashMap<>(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    if (ScanConfig.TARGET_KEYS.stream().anyMatch(cliCopy::containsKey)) {
      for (String key : ScanConfig.TARGET_KEYS) {
        if (!cliCopy.containsKey(key) && yamlCopy.remove(key) != null) {
          warnings.accept("CLI target replaces YAML key: " + key);
        }
      }
    }

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged, warnings);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective, Consumer<String> warn) {
    if (!DefaultsForMode.SCAN.equalsIgnoreCase(mode)) {
      return;
    }
    boolean noPrint = Boolean.parseBoolean(trim(effective.get("noPrint")));
    if (noPrint && trim(effective.get("out")).isEmpty()) {
      warn.accept("noPrint without out: open ports will only appear in the summary count");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
