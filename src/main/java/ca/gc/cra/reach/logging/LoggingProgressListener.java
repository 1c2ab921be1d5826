package ca.gc.cra.reach.logging;

import ca.gc.cra.reach.application.port.ScanProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress listener that logs each update at INFO, e.g. {@code [scan] progress 300/2540 (11.8%)}.
 *
 * @since 0.1.0
 */
public final class LoggingProgressListener implements ScanProgressListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

  @Override
  public void onProgress(String phase, int completed, int total) {
    log.info("[{}] progress {}", phase, Logs.progress(completed, total));
  }
}
