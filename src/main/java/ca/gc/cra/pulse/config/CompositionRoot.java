package ca.gc.cra.pulse.config;

import ca.gc.cra.pulse.application.classify.ReferrerClassifier;
import ca.gc.cra.pulse.application.classify.UserAgentClassifier;
import ca.gc.cra.pulse.application.geo.GeoAggregator;
import ca.gc.cra.pulse.application.metrics.MetricsCalculator;
import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.summary.DashboardSummaryUseCase;
import ca.gc.cra.pulse.application.time.TimePeriodAggregator;
import ca.gc.cra.pulse.application.time.TimeSeriesAggregator;
import ca.gc.cra.pulse.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.pulse.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pulse.logging.LoggingConfigurator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns an {@link EngineConfig} into a wired {@link AnalyticsEngine}.
 * <p><strong>Why:</strong> Keeps adapter selection (metric exporter, logging level) out of the application
 * layer.</p>
 * <p><strong>Role:</strong> Bootstrap layer invoked once by the hosting API process.</p>
 * <p><strong>Thread-safety:</strong> Holds only the immutable configuration; each call to {@link #engine()} builds
 * a new graph.</p>
 * <p><strong>Observability:</strong> Logs the effective configuration at INFO when the engine is built.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final EngineConfig config;

  /**
   * Creates a composition root.
   *
   * @param config engine configuration; must not be {@code null}
   */
  public CompositionRoot(EngineConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Builds the engine, choosing the metric adapter from {@link EngineConfig#metricsExporter()}.
   *
   * @return wired engine; close it to release the metric exporter
   */
  public AnalyticsEngine engine() {
    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    MetricsPort metrics;
    AutoCloseable resources;
    if (config.metricsExporter() == EngineConfig.MetricsExporter.OTLP) {
      OpenTelemetryMetricsAdapter adapter =
          OpenTelemetryMetricsAdapter.otlp(config.metricsEndpoint(), config.resourceAttributes());
      metrics = adapter;
      resources = adapter;
    } else {
      metrics = new NoOpMetricsAdapter();
      resources = () -> { };
    }
    return engine(metrics, resources);
  }

  /**
   * Builds the engine around an explicit metric sink.
   *
   * @param metrics metric sink
   * @return wired engine; closing it does not close {@code metrics}
   */
  public AnalyticsEngine engine(MetricsPort metrics) {
    return engine(metrics, () -> { });
  }

  private AnalyticsEngine engine(MetricsPort metrics, AutoCloseable resources) {
    UserAgentClassifier userAgents = new UserAgentClassifier();
    ReferrerClassifier referrers = new ReferrerClassifier();
    GeoAggregator geo = new GeoAggregator();
    TimePeriodAggregator timePeriods = new TimePeriodAggregator(config.weekStart());
    MetricsCalculator calculator = new MetricsCalculator();
    DashboardSummaryUseCase.Options options = new DashboardSummaryUseCase.Options(
        config.excludeBots(), config.fillGaps(), config.anomalyThreshold(), config.topLimit());
    DashboardSummaryUseCase summaries = new DashboardSummaryUseCase(
        userAgents, referrers, geo, timePeriods, calculator, options, metrics);
    log.info("PULSE engine ready: weekStart={} anomalyThreshold={} topLimit={} excludeBots={} fillGaps={} "
            + "metricsExporter={}",
        config.weekStart(), config.anomalyThreshold(), config.topLimit(), config.excludeBots(),
        config.fillGaps(), config.metricsExporter());
    return new AnalyticsEngine(
        config, userAgents, referrers, geo, timePeriods, new TimeSeriesAggregator(), calculator, summaries,
        resources);
  }
}
