package ca.gc.cra.reach.validation;

import java.util.regex.Pattern;

/**
 * IPv4 literal parsing and arithmetic helpers for REACH target expansion.
 * <p>Stateless and thread-safe. Parsing never performs DNS lookups.</p>
 */
public final class Net {

  /** Largest unsigned 32-bit value, i.e. {@code 255.255.255.255}. */
  public static final long MAX_IPV4 = 0xFFFF_FFFFL;

  // IPv4 dotted-quad shape (fast pre-check); we still range-check octets.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses a dotted-quad IPv4 literal into its unsigned 32-bit value.
   *
   * @param literal address such as {@code 10.0.0.5}; surrounding whitespace is ignored
   * @return address as a value in {@code [0, MAX_IPV4]}
   * @throws IllegalArgumentException if the literal is not a well-formed IPv4 address
   */
  public static long parseIpv4(String literal) {
    if (literal == null) {
      throw new IllegalArgumentException("IPv4 address must not be null");
    }
    String value = literal.trim();
    if (!IPV4_PATTERN.matcher(value).matches()) {
      throw new IllegalArgumentException("invalid IPv4 address: " + value);
    }
    long result = 0;
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? value.indexOf('.', startIndex) : value.length();
      final int octet = Integer.parseInt(value.substring(startIndex, endIndex));
      if (octet > 255) {
        throw new IllegalArgumentException("invalid IPv4 address: " + value + " (octet " + octet + " > 255)");
      }
      result = (result << 8) | octet;
      startIndex = endIndex + 1;
    }
    return result;
  }

  /**
   * Renders an unsigned 32-bit value as a dotted-quad IPv4 literal.
   *
   * @param address value in {@code [0, MAX_IPV4]}
   * @return dotted-quad literal
   * @throws IllegalArgumentException if the value is outside the IPv4 space
   */
  public static String formatIpv4(long address) {
    Numbers.requireRange("IPv4 address", address, 0, MAX_IPV4);
    return ((address >>> 24) & 0xFF) + "."
        + ((address >>> 16) & 0xFF) + "."
        + ((address >>> 8) & 0xFF) + "."
        + (address & 0xFF);
  }

  /**
   * Reports whether a value has the dotted-quad shape of an IPv4 literal; octet ranges are not checked.
   *
   * @param value candidate text; surrounding whitespace is ignored
   * @return {@code true} for values such as {@code 10.0.0.5} or {@code 10.0.0.999}
   */
  public static boolean looksLikeIpv4(String value) {
    return value != null && IPV4_PATTERN.matcher(value.trim()).matches();
  }
}
