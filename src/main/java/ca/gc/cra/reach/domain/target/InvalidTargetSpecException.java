package ca.gc.cra.reach.domain.target;

import ca.gc.cra.reach.domain.ScanSpecException;

/**
 * Raised when a CIDR block, IP literal, or hosts file cannot be parsed or read.
 *
 * @since 0.1.0
 */
public final class InvalidTargetSpecException extends ScanSpecException {
  private static final long serialVersionUID = 1L;

  public InvalidTargetSpecException(String message) {
    super(message);
  }

  public InvalidTargetSpecException(String message, Throwable cause) {
    super(message, cause);
  }
}
