/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.reach.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are updated concurrently from probe workers.</p>
 * <p><strong>Metrics:</strong> Publishes {@code scan.*} and {@code prefilter.*} instruments under the
 * {@code ca.gc.cra.reach} scope.</p>
 */
package ca.gc.cra.reach.infrastructure.metrics;
