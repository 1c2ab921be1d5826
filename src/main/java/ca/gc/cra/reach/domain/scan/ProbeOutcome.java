package ca.gc.cra.reach.domain.scan;

/**
 * Result of a single TCP connect probe. Every failure category (timeout, refusal, unreachable network,
 * unresolved host) collapses into {@link #NOT_OPEN}.
 *
 * @since 0.1.0
 */
public enum ProbeOutcome {
  /** The TCP handshake completed within the timeout. */
  OPEN,
  /** The handshake did not complete for any reason. */
  NOT_OPEN
}
