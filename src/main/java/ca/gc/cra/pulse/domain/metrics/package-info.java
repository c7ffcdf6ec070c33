/**
 * Result types of the metrics calculator.
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 */
package ca.gc.cra.pulse.domain.metrics;
