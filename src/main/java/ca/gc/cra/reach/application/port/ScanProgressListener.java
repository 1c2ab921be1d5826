package ca.gc.cra.reach.application.port;

/**
 * Observer notified as probes complete. Purely observational: implementations must return quickly and must not
 * block or throttle the pool.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ScanProgressListener {
  /**
   * Reports progress.
   *
   * @param phase {@code prefilter} or {@code scan}
   * @param completed tasks completed so far
   * @param total tasks in the phase
   */
  void onProgress(String phase, int completed, int total);

  /** Listener that ignores every update. */
  ScanProgressListener NONE = (phase, completed, total) -> {};
}
