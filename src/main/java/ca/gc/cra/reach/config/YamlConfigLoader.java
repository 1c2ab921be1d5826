package ca.gc.cra.reach.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a REACH YAML file into the same flat {@code key=value} shape the CLI produces.
 *
 * <p>Two sections are consulted: {@code common}, then the command's own section ({@code scan} or
 * {@code targets}), so command values win. Section names match case-insensitively. Scalar lists become
 * comma-joined values ({@code ports: [22, 80]} reads as {@code ports=22,80}); nested mappings become dotted keys.
 * Only plain YAML types are constructed.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the merged values for {@code mode}.
   *
   * @param path YAML file
   * @param mode command name
   * @return merged values; empty when the file does not exist, an empty map for an empty document
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or not shaped as sections of scalars
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Map<?, ?> root = readRoot(path);
    if (root.isEmpty()) {
      return Optional.of(Map.of());
    }
    Map<String, String> values = new LinkedHashMap<>();
    mergeSection(root, COMMON_SECTION, values);
    mergeSection(root, mode.trim().toLowerCase(Locale.ROOT), values);
    return Optional.of(Map.copyOf(values));
  }

  private static Map<?, ?> readRoot(Path path) throws IOException {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = yaml.load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping of sections");
    }
    return root;
  }

  private static void mergeSection(Map<?, ?> root, String section, Map<String, String> into) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String name && name.trim().equalsIgnoreCase(section)) {
        Object body = entry.getValue();
        if (body == null) {
          return;
        }
        if (!(body instanceof Map<?, ?> values)) {
          throw new IllegalArgumentException(section + " section must be a mapping");
        }
        collect(values, section, "", into);
        return;
      }
    }
  }

  private static void collect(Map<?, ?> values, String section, String prefix, Map<String, String> into) {
    for (Map.Entry<?, ?> entry : values.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(section + " section contains a blank or non-string key");
      }
      String key = prefix + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(nested, section, key + '.', into);
      } else {
        into.put(key, render(key, value));
      }
    }
  }

  private static String render(String key, Object value) {
    if (value == null) {
      return "";
    }
    if (!(value instanceof Iterable<?> items)) {
      return value.toString();
    }
    List<String> parts = new ArrayList<>();
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain only scalars");
      }
      parts.add(item.toString());
    }
    return String.join(",", parts);
  }
}
