/**
 * <strong>Purpose:</strong> Target address-space model and expansion.
 * <p><strong>Pipeline role:</strong> Runs once before the liveness prefilter and scan engine; output is an
 * immutable ordered host list.
 * <p><strong>Security:</strong> Expansion sizes are bounded so a mistyped prefix cannot exhaust memory.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.domain.target;
