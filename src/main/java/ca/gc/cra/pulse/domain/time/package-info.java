/**
 * Time-bucketing value types: granularities, ranges, buckets and series points.
 * <p><strong>Role:</strong> Shared vocabulary of the time aggregators and the dashboard series.</p>
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 * <p><strong>Time zone:</strong> All bucket boundaries are computed in UTC.</p>
 */
package ca.gc.cra.pulse.domain.time;
