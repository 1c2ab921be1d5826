package ca.gc.cra.reach.application.port;

import ca.gc.cra.reach.domain.scan.OpenPair;

/**
 * Observer notified from worker threads as soon as an open pair is found, before the final sorted emission.
 * Implementations must be thread-safe.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OpenPairListener {
  void onOpen(OpenPair pair);

  /** Listener that ignores every pair. */
  OpenPairListener NONE = pair -> {};
}
