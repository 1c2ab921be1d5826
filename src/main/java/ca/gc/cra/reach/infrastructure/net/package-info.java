/**
 * Network adapters implementing the TCP connect probe and ping-based liveness ports.
 * <p><strong>Concurrency:</strong> Adapters are stateless and invoked concurrently from probe pools.</p>
 * <p><strong>Security:</strong> Hosts beginning with {@code -} are never passed to the ping command line.</p>
 */
package ca.gc.cra.reach.infrastructure.net;
