/**
 * Port specification parsing and the immutable {@link ca.gc.cra.reach.domain.port.PortSet} value type.
 *
 * @since 0.1.0
 */
package ca.gc.cra.reach.domain.port;
