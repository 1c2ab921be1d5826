package ca.gc.cra.reach.domain.port;

import ca.gc.cra.reach.domain.ScanSpecException;

/**
 * Raised when a port token is neither an integer nor an integer range.
 *
 * @since 0.1.0
 */
public final class InvalidPortSpecException extends ScanSpecException {
  private static final long serialVersionUID = 1L;

  public InvalidPortSpecException(String message) {
    super(message);
  }

  public InvalidPortSpecException(String message, Throwable cause) {
    super(message, cause);
  }
}
