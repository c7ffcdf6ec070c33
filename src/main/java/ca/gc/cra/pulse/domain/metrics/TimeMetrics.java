package ca.gc.cra.pulse.domain.metrics;

/**
 * Time-on-page statistics over pageviews that carry a duration.
 *
 * @param avgTimeOnPage mean seconds, whole number
 * @param medianTimeOnPage median seconds, whole number
 * @param totalTimeOnSite summed seconds
 *
 * @since 0.1.0
 */
public record TimeMetrics(long avgTimeOnPage, long medianTimeOnPage, double totalTimeOnSite) {}
