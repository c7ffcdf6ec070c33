/**
 * Application layer of PULSE: classifiers, aggregators, the metrics calculator and the dashboard summary use case.
 * <p><strong>Role:</strong> Pure computation over caller-supplied records; no I/O.</p>
 * <p><strong>Concurrency:</strong> Services are stateless or immutable; every call owns its accumulators.</p>
 * <p><strong>Metrics:</strong> Emits the {@code pulse.summary.*} namespace through {@code MetricsPort}.</p>
 */
package ca.gc.cra.pulse.application;
