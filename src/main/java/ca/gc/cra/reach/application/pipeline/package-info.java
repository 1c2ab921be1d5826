/**
 * Application pipelines that coordinate the liveness prefilter and the port scan.
 * <p>Each phase owns a fixed-size pool created per call and shut down before the call returns; worker threads are
 * named {@code reach-prefilter-*} and {@code reach-scan-*} and carry the MDC key {@code phase}.</p>
 * <p>Use cases accept resolved inputs (see {@code ca.gc.cra.reach.config}) and report outcomes via
 * {@link ca.gc.cra.reach.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.application.pipeline;
