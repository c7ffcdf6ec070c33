package ca.gc.cra.pulse.config;

import ca.gc.cra.pulse.application.classify.ReferrerClassifier;
import ca.gc.cra.pulse.application.classify.UserAgentClassifier;
import ca.gc.cra.pulse.application.geo.GeoAggregator;
import ca.gc.cra.pulse.application.metrics.MetricsCalculator;
import ca.gc.cra.pulse.application.summary.DashboardSummary;
import ca.gc.cra.pulse.application.summary.DashboardSummaryUseCase;
import ca.gc.cra.pulse.application.summary.SummaryRequest;
import ca.gc.cra.pulse.application.time.TimePeriodAggregator;
import ca.gc.cra.pulse.application.time.TimeSeriesAggregator;
import ca.gc.cra.pulse.infrastructure.json.DashboardSummaryJsonWriter;
import java.util.Objects;

/**
 * Wired engine handed to the API layer: the individual components plus the summary use case.
 *
 * <p>Closing the engine shuts down the metric exporter, if one was started.</p>
 *
 * @since 0.1.0
 * @see CompositionRoot
 */
public final class AnalyticsEngine implements AutoCloseable {
  private final EngineConfig config;
  private final UserAgentClassifier userAgents;
  private final ReferrerClassifier referrers;
  private final GeoAggregator geo;
  private final TimePeriodAggregator timePeriods;
  private final TimeSeriesAggregator timeSeries;
  private final MetricsCalculator metrics;
  private final DashboardSummaryUseCase summaries;
  private final AutoCloseable resources;
  private final DashboardSummaryJsonWriter jsonWriter = new DashboardSummaryJsonWriter();

  AnalyticsEngine(
      EngineConfig config,
      UserAgentClassifier userAgents,
      ReferrerClassifier referrers,
      GeoAggregator geo,
      TimePeriodAggregator timePeriods,
      TimeSeriesAggregator timeSeries,
      MetricsCalculator metrics,
      DashboardSummaryUseCase summaries,
      AutoCloseable resources) {
    this.config = Objects.requireNonNull(config, "config");
    this.userAgents = Objects.requireNonNull(userAgents, "userAgents");
    this.referrers = Objects.requireNonNull(referrers, "referrers");
    this.geo = Objects.requireNonNull(geo, "geo");
    this.timePeriods = Objects.requireNonNull(timePeriods, "timePeriods");
    this.timeSeries = Objects.requireNonNull(timeSeries, "timeSeries");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.summaries = Objects.requireNonNull(summaries, "summaries");
    this.resources = Objects.requireNonNull(resources, "resources");
  }

  /**
   * Computes a dashboard summary.
   *
   * @param request summary input
   * @return dashboard summary
   */
  public DashboardSummary summarize(SummaryRequest request) {
    return summaries.summarize(request);
  }

  /**
   * Computes a dashboard summary and renders it as the JSON document served to the dashboard.
   *
   * @param request summary input
   * @return JSON document
   */
  public String summarizeJson(SummaryRequest request) {
    return jsonWriter.toJson(summarize(request));
  }

  public EngineConfig config() {
    return config;
  }

  public UserAgentClassifier userAgents() {
    return userAgents;
  }

  public ReferrerClassifier referrers() {
    return referrers;
  }

  public GeoAggregator geo() {
    return geo;
  }

  public TimePeriodAggregator timePeriods() {
    return timePeriods;
  }

  public TimeSeriesAggregator timeSeries() {
    return timeSeries;
  }

  public MetricsCalculator metrics() {
    return metrics;
  }

  @Override
  public void close() throws Exception {
    resources.close();
  }
}
