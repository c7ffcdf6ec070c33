package ca.gc.cra.pulse.application.summary;

import ca.gc.cra.pulse.domain.metrics.AnomalyReport;
import ca.gc.cra.pulse.domain.metrics.MetricsSummary;
import ca.gc.cra.pulse.domain.metrics.PerformanceMetrics;
import ca.gc.cra.pulse.domain.stats.RankedCount;
import ca.gc.cra.pulse.domain.time.AggregatedBucket;
import ca.gc.cra.pulse.domain.time.Granularity;
import java.util.List;
import java.util.Objects;

/**
 * Everything a dashboard renders for one site and reporting window.
 *
 * @param totals headline totals including the conversion rate
 * @param pages top paths
 * @param sources top referrer sources
 * @param mediums traffic mediums
 * @param devices form factors
 * @param browsers browser families
 * @param operatingSystems operating systems
 * @param countries countries, {@code Unknown} for unresolved pageviews
 * @param languages browser languages
 * @param campaigns {@code utm_campaign} values
 * @param events conversion event types
 * @param granularity bucket width of {@code series}
 * @param series chart buckets in ascending order
 * @param anomalies anomaly report over the series' pageview counts
 * @param returnVisitorRate percentage of identified visitors with several sessions
 * @param sessionQuality mean engagement score
 * @param sessionDuration closed-session duration statistics in seconds
 * @param mobilePercentage share of mobile and tablet pageviews
 * @param botsFiltered pageviews removed as bot traffic
 *
 * @since 0.1.0
 */
public record DashboardSummary(
    MetricsSummary totals,
    List<RankedCount> pages,
    List<RankedCount> sources,
    List<RankedCount> mediums,
    List<RankedCount> devices,
    List<RankedCount> browsers,
    List<RankedCount> operatingSystems,
    List<RankedCount> countries,
    List<RankedCount> languages,
    List<RankedCount> campaigns,
    List<RankedCount> events,
    Granularity granularity,
    List<AggregatedBucket> series,
    AnomalyReport anomalies,
    double returnVisitorRate,
    double sessionQuality,
    PerformanceMetrics sessionDuration,
    double mobilePercentage,
    long botsFiltered) {

  /**
   * Validates constructor invariants and copies lists.
   */
  public DashboardSummary {
    Objects.requireNonNull(totals, "totals");
    pages = List.copyOf(pages);
    sources = List.copyOf(sources);
    mediums = List.copyOf(mediums);
    devices = List.copyOf(devices);
    browsers = List.copyOf(browsers);
    operatingSystems = List.copyOf(operatingSystems);
    countries = List.copyOf(countries);
    languages = List.copyOf(languages);
    campaigns = List.copyOf(campaigns);
    events = List.copyOf(events);
    Objects.requireNonNull(granularity, "granularity");
    series = List.copyOf(series);
    Objects.requireNonNull(anomalies, "anomalies");
    Objects.requireNonNull(sessionDuration, "sessionDuration");
  }
}
