package ca.gc.cra.reach.infrastructure.persistence;

import ca.gc.cra.reach.domain.ScanSpecException;

/**
 * Raised when an explicit output destination has an extension other than {@code .csv} or {@code .json}.
 *
 * @since 0.1.0
 */
public final class UnsupportedOutputFormatException extends ScanSpecException {
  private static final long serialVersionUID = 1L;

  public UnsupportedOutputFormatException(String message) {
    super(message);
  }
}
