package ca.gc.cra.reach.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by REACH CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid probe timeouts and worker counts before the scan pools
 * allocate threads.
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration loaders.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., workers, ports)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a decimal value lies in the half-open interval {@code (exclusiveMin, max]}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value (e.g., timeout seconds)
   * @param exclusiveMin lower bound that the value must exceed
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if the value is NaN, infinite, or outside the interval
   */
  public static double requireAboveAtMost(String name, double value, double exclusiveMin, double max) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value <= exclusiveMin || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be greater than " + exclusiveMin + " and at most " + max
              + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a base-10 integer, reporting the parameter name on failure.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is blank or not an integer
   */
  public static int parseInt(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + trimmed + ")", ex);
    }
  }

  /**
   * Parses a decimal number, reporting the parameter name on failure.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; surrounding whitespace is ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is blank or not a number
   */
  public static double parseDouble(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + trimmed + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
