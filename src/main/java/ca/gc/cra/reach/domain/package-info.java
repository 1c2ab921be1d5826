/**
 * <strong>Purpose:</strong> Domain model for REACH: target and port specifications, probe tasks, and
 * scan aggregates.
 * <p><strong>Pipeline role:</strong> Pure value types and parsers shared by the prefilter, scan engine, and sinks.
 * <p><strong>Concurrency:</strong> Value types are immutable; {@link ca.gc.cra.reach.domain.scan.ScanRun}
 * is the only mutable aggregate and is safe for concurrent workers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.domain;
