package ca.gc.cra.reach.domain.port;

import java.util.BitSet;
import java.util.regex.Pattern;

/**
 * Parses textual port specifications such as {@code 22}, {@code 22,80}, {@code 8000-8010}, or any comma-separated
 * mix of them.
 *
 * <p>Tokens are trimmed and empty tokens skipped. A token containing {@code -} is an inclusive range split at the
 * first hyphen; reversed bounds are swapped. Values outside {@code [1, 65535]} are silently discarded, so a
 * hand-edited specification with a stray {@code 0} or {@code 70000} still scans its valid ports. Only
 * non-numeric input is an error.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PortSpecParser {
  private static final Pattern NUMBER = Pattern.compile("\\+?\\d+");
  // Any value above the valid range behaves the same once filtered, so large literals clamp here.
  private static final int OUT_OF_RANGE = PortSet.MAX_PORT + 1;

  private PortSpecParser() {}

  /**
   * Parses a specification; the result may be empty when every value was out of range.
   *
   * @param spec specification text
   * @return ascending, duplicate-free port set
   * @throws InvalidPortSpecException if a token is not an integer or integer range
   */
  public static PortSet parse(String spec) {
    if (spec == null) {
      throw new InvalidPortSpecException("port specification must not be null");
    }
    BitSet bits = new BitSet(PortSet.MAX_PORT + 1);
    for (String raw : spec.split(",")) {
      String token = raw.trim();
      if (token.isEmpty()) {
        continue;
      }
      int dash = token.indexOf('-');
      if (dash >= 0) {
        int lo = parseNumber(token.substring(0, dash), token);
        int hi = parseNumber(token.substring(dash + 1), token);
        if (lo > hi) {
          int swap = lo;
          lo = hi;
          hi = swap;
        }
        int from = Math.max(lo, PortSet.MIN_PORT);
        int to = Math.min(hi, PortSet.MAX_PORT);
        if (from <= to) {
          bits.set(from, to + 1);
        }
      } else {
        int port = parseNumber(token, token);
        if (port >= PortSet.MIN_PORT && port <= PortSet.MAX_PORT) {
          bits.set(port);
        }
      }
    }
    return PortSet.fromBits(bits);
  }

  /**
   * Parses a specification and requires at least one valid port.
   *
   * @param spec specification text
   * @return non-empty port set
   * @throws InvalidPortSpecException if a token is malformed
   * @throws EmptyPortSpecException if no port in {@code [1, 65535]} remains
   */
  public static PortSet parseNonEmpty(String spec) {
    PortSet ports = parse(spec);
    if (ports.isEmpty()) {
      throw new EmptyPortSpecException("No valid ports (1-65535) in specification '" + spec + "'");
    }
    return ports;
  }

  private static int parseNumber(String raw, String token) {
    String value = raw.trim();
    if (!NUMBER.matcher(value).matches()) {
      throw new InvalidPortSpecException("Invalid port token '" + token + "': '" + value + "' is not an integer");
    }
    String digits = value.startsWith("+") ? value.substring(1) : value;
    int firstSignificant = 0;
    while (firstSignificant < digits.length() - 1 && digits.charAt(firstSignificant) == '0') {
      firstSignificant++;
    }
    String significant = digits.substring(firstSignificant);
    if (significant.length() > 6) {
      return OUT_OF_RANGE;
    }
    return Math.min(Integer.parseInt(significant), OUT_OF_RANGE);
  }
}
