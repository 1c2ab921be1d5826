package ca.gc.cra.reach.domain.target;

import ca.gc.cra.reach.domain.ScanSpecException;

/**
 * Raised when a target specification resolves to zero hosts.
 *
 * @since 0.1.0
 */
public final class EmptyTargetSpecException extends ScanSpecException {
  private static final long serialVersionUID = 1L;

  public EmptyTargetSpecException(String message) {
    super(message);
  }
}
