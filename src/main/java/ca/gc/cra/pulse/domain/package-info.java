/**
 * Immutable domain values of the analytics engine: events, classifications, geo, time buckets and metric
 * results.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.</p>
 */
package ca.gc.cra.pulse.domain;
