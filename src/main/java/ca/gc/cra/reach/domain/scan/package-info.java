/**
 * <strong>Purpose:</strong> Probe task, probe result, and scan aggregate types.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.reach.domain.scan.ScanRun} is written by every scan worker;
 * all other types are immutable records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.domain.scan;
