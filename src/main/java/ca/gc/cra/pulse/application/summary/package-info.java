/**
 * Dashboard summary use case: the single entry point the API layer calls per site and reporting window.
 * <p><strong>Concurrency:</strong> Use case is immutable; requests copy their inputs.</p>
 * <p><strong>Observability:</strong> Logs one INFO line per summary and records summary metrics.</p>
 */
package ca.gc.cra.pulse.application.summary;
