/**
 * <strong>Purpose:</strong> Ports defining the probe, liveness, sink, metrics, and progress contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.
 * <p><strong>Concurrency:</strong> Probe, liveness, metrics, and open-pair listener implementations are called
 * concurrently from worker threads and must be thread-safe.
 * <p><strong>Security:</strong> Port boundaries assume validated inputs from configuration modules.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.application.port;
