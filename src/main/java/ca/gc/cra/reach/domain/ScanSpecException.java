package ca.gc.cra.reach.domain;

/**
 * Base type for fatal scan configuration errors (targets, ports, output format).
 *
 * <p>Extends {@link IllegalArgumentException} so CLI layers that already treat invalid arguments
 * uniformly keep working; subclasses let callers tell the categories apart.</p>
 *
 * @since 0.1.0
 */
public class ScanSpecException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message operator-facing description
   */
  public ScanSpecException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and underlying cause.
   *
   * @param message operator-facing description
   * @param cause parse or I/O failure that triggered the error
   */
  public ScanSpecException(String message, Throwable cause) {
    super(message, cause);
  }
}
