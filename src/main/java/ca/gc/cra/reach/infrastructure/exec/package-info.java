/**
 * Executor factories for probe worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring thread pools for the prefilter and scan stages.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry only the stage prefix and an index, never target hosts.</p>
 */
package ca.gc.cra.reach.infrastructure.exec;
