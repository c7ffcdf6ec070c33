package ca.gc.cra.pulse.domain.metrics;

/**
 * Headline totals for a set of pageviews and sessions.
 *
 * @param totalPageViews pageviews
 * @param uniqueVisitors distinct visitor ids among the pageviews
 * @param totalSessions sessions
 * @param bounceRate percentage of single-page sessions, one decimal
 * @param avgSessionDuration mean closed-session duration in whole seconds
 * @param avgPageViewsPerSession mean pageviews per session, one decimal
 * @param conversionRate percentage of converted sessions; {@code null} when no conversions were supplied
 *
 * @since 0.1.0
 */
public record MetricsSummary(
    long totalPageViews,
    long uniqueVisitors,
    long totalSessions,
    double bounceRate,
    long avgSessionDuration,
    double avgPageViewsPerSession,
    Double conversionRate) {

  /**
   * Returns a copy carrying a conversion rate.
   *
   * @param rate conversion percentage
   * @return summary with {@code conversionRate} set
   */
  public MetricsSummary withConversionRate(double rate) {
    return new MetricsSummary(
        totalPageViews, uniqueVisitors, totalSessions, bounceRate, avgSessionDuration, avgPageViewsPerSession, rate);
  }
}
