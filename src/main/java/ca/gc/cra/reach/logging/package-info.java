/**
 * <strong>Purpose:</strong> Logging utilities: verbosity control, log-safe formatting, and progress logging.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.reach.logging.LoggingProgressListener} is called from pool
 * workers; the other helpers are stateless.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.logging;
