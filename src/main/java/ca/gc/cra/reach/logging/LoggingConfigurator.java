package ca.gc.cra.reach.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts REACH log levels from CLI flags.
 * <p><strong>Role:</strong> Bridges {@code --verbose} to the Logback backend at CLI startup.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread, before any pool starts.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String APP_LOGGER = "ca.gc.cra.reach";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the REACH logger threshold to DEBUG so per-probe diagnostics become visible.
   */
  public static void enableVerboseLogging() {
    setAppLevel(Level.DEBUG);
  }

  /**
   * Returns whether DEBUG output is enabled for REACH loggers.
   *
   * @return {@code true} after {@link #enableVerboseLogging()}
   */
  public static boolean isVerbose() {
    return LoggerFactory.getLogger(APP_LOGGER).isDebugEnabled();
  }

  static void setAppLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger app = context.getLogger(APP_LOGGER);
      if (!level.equals(app.getLevel())) {
        app.setLevel(level);
      }
      return;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
