/**
 * Referrer classification results and medium labels.
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 */
package ca.gc.cra.pulse.domain.referrer;
