/**
 * Result sinks rendering the sorted open pairs to the console, CSV, or JSON.
 * <p><strong>Role:</strong> Adapter implementations of {@link ca.gc.cra.reach.application.port.ResultSinkPort}.</p>
 * <p><strong>Concurrency:</strong> Invoked once per run from the coordinating thread.</p>
 * <p><strong>Security:</strong> File sinks validate that the destination is not a directory before writing.</p>
 */
package ca.gc.cra.reach.infrastructure.persistence;
