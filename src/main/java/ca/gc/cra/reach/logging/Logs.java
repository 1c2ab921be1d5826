package ca.gc.cra.reach.logging;

import java.util.Locale;

/**
 * <strong>What:</strong> Formatting helpers for user-supplied values in log lines.
 * <p><strong>Why:</strong> Hosts files and CLI values are arbitrary text; log lines stay single-line and
 * bounded.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Bounds a string to {@code maxChars} characters and replaces control characters with {@code ?}.
   *
   * @param value string to sanitize; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return printable value, suffixed with {@code "... (truncated, N chars)"} when shortened
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    boolean shortened = value.length() > maxChars;
    String head = shortened ? value.substring(0, maxChars) : value;
    StringBuilder out = new StringBuilder(head.length() + 32);
    for (int i = 0; i < head.length(); i++) {
      char c = head.charAt(i);
      out.append(Character.isISOControl(c) ? '?' : c);
    }
    if (shortened) {
      out.append("... (truncated, ").append(value.length()).append(" chars)");
    }
    return out.toString();
  }

  /**
   * Formats a completion ratio, e.g. {@code 100/2540 (3.9%)}.
   *
   * @param completed completed units
   * @param total total units; zero yields {@code 100.0%}
   * @return progress text
   */
  public static String progress(int completed, int total) {
    double percent = total == 0 ? 100.0 : (completed * 100.0) / total;
    return String.format(Locale.ROOT, "%d/%d (%.1f%%)", completed, total, percent);
  }
}
