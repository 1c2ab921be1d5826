package ca.gc.cra.reach.api;

import ca.gc.cra.reach.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Keys may carry a leading {@code --} ({@code --out=a.csv} equals {@code out=a.csv}). A repeated {@code ports}
 * argument is appended to the earlier one, so {@code ports=22 ports=80} scans both; any other repeated key is an
 * error. Stateless and thread-safe.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final String APPENDABLE_KEY = "ports";

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw {@code key=value} arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException for a malformed argument, an invalid key, or a repeated key
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = stripDashes(arg.substring(0, idx).trim());
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      String previous = map.get(key);
      if (previous == null) {
        map.put(key, value);
      } else if (APPENDABLE_KEY.equals(key)) {
        map.put(key, previous + "," + value);
      } else {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static String stripDashes(String key) {
    return key.startsWith("--") ? key.substring(2) : key;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    Strings.requireNonBlank(key, value);
  }
}
