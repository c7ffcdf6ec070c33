/**
 * Session, pageview and conversion metrics: rates, durations, percentiles, engagement and anomalies.
 * <p><strong>Concurrency:</strong> Stateless services.</p>
 */
package ca.gc.cra.pulse.application.metrics;
