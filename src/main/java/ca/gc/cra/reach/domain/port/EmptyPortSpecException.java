package ca.gc.cra.reach.domain.port;

import ca.gc.cra.reach.domain.ScanSpecException;

/**
 * Raised when a port specification parses but leaves no port in {@code [1, 65535]}.
 *
 * @since 0.1.0
 */
public final class EmptyPortSpecException extends ScanSpecException {
  private static final long serialVersionUID = 1L;

  public EmptyPortSpecException(String message) {
    super(message);
  }
}
