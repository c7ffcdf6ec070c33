/**
 * Time aggregation: calendar and custom-window bucketing of pageviews, plus scalar series helpers.
 * <p><strong>Role:</strong> Produces the chart series consumed by the dashboard summary.</p>
 * <p><strong>Concurrency:</strong> Services are immutable; accumulators never outlive a call.</p>
 */
package ca.gc.cra.pulse.application.time;
