/**
 * Outbound ports of the PULSE application layer.
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe.</p>
 */
package ca.gc.cra.pulse.application.port;
