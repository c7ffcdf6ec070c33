package ca.gc.cra.pulse.application.summary;

import ca.gc.cra.pulse.application.classify.ReferrerClassifier;
import ca.gc.cra.pulse.application.classify.UserAgentClassifier;
import ca.gc.cra.pulse.application.geo.GeoAggregator;
import ca.gc.cra.pulse.application.metrics.MetricsCalculator;
import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.time.TimePeriodAggregator;
import ca.gc.cra.pulse.domain.device.DeviceInfo;
import ca.gc.cra.pulse.domain.event.ConversionEvent;
import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.domain.event.Session;
import ca.gc.cra.pulse.domain.geo.GeoLocation;
import ca.gc.cra.pulse.domain.geo.GeoStats;
import ca.gc.cra.pulse.domain.metrics.AnomalyReport;
import ca.gc.cra.pulse.domain.metrics.MetricsSummary;
import ca.gc.cra.pulse.domain.metrics.PerformanceMetrics;
import ca.gc.cra.pulse.domain.referrer.ReferrerInfo;
import ca.gc.cra.pulse.domain.stats.RankedCount;
import ca.gc.cra.pulse.domain.time.AggregatedBucket;
import ca.gc.cra.pulse.domain.time.TimeRange;
import ca.gc.cra.pulse.domain.util.Rounding;
import ca.gc.cra.pulse.logging.Logs;
import ca.gc.cra.pulse.validation.Numbers;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the complete dashboard summary for one site and reporting window.
 * <p><strong>Why:</strong> The API layer needs every breakdown, series and metric in one call, computed from a
 * single classification pass so the numbers agree with each other.</p>
 * <p><strong>Role:</strong> Application use case composing the classifiers, aggregators and metrics calculator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply the reporting window, then remove bot traffic when configured.</li>
 *   <li>Classify each remaining pageview's user agent and referrer exactly once.</li>
 *   <li>Produce ranked breakdowns, the chart series, anomaly report and headline metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable collaborators; concurrent summaries share no mutable state.</p>
 * <p><strong>Performance:</strong> Linear in events plus the sorting done by the aggregators.</p>
 * <p><strong>Observability:</strong> One INFO line per summary; emits {@code pulse.summary.requests},
 * {@code pulse.summary.events}, {@code pulse.summary.bots.filtered}, {@code pulse.summary.anomalies} and
 * {@code pulse.summary.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class DashboardSummaryUseCase {
  private static final Logger log = LoggerFactory.getLogger(DashboardSummaryUseCase.class);
  private static final int MAX_LOGGED_USER_AGENT_BYTES = 128;

  private final UserAgentClassifier userAgents;
  private final ReferrerClassifier referrers;
  private final GeoAggregator geo;
  private final TimePeriodAggregator time;
  private final MetricsCalculator calculator;
  private final Options options;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param userAgents user-agent classifier
   * @param referrers referrer classifier
   * @param geo geo aggregator
   * @param time time-period aggregator, carrying the week start
   * @param calculator metrics calculator
   * @param options summary behaviour switches
   * @param metrics metric sink; use {@link MetricsPort#NO_OP} to disable
   */
  public DashboardSummaryUseCase(
      UserAgentClassifier userAgents,
      ReferrerClassifier referrers,
      GeoAggregator geo,
      TimePeriodAggregator time,
      MetricsCalculator calculator,
      Options options,
      MetricsPort metrics) {
    this.userAgents = Objects.requireNonNull(userAgents, "userAgents");
    this.referrers = Objects.requireNonNull(referrers, "referrers");
    this.geo = Objects.requireNonNull(geo, "geo");
    this.time = Objects.requireNonNull(time, "time");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Computes the summary.
   *
   * @param request events, sessions and reporting parameters
   * @return dashboard summary; empty breakdowns and zero metrics when no data passes the filters
   */
  public DashboardSummary summarize(SummaryRequest request) {
    Objects.requireNonNull(request, "request");
    long started = System.nanoTime();
    metrics.increment("pulse.summary.requests");

    TimeRange range = request.range();
    List<EventRecord> inRange = new ArrayList<>(request.events().size());
    for (EventRecord event : request.events()) {
      if (range == null || range.contains(event.timestamp())) {
        inRange.add(event);
      }
    }

    List<EventRecord> events = new ArrayList<>(inRange.size());
    List<DeviceInfo> devices = new ArrayList<>(inRange.size());
    Set<String> botSessions = new HashSet<>();
    Set<String> humanSessions = new HashSet<>();
    long botsFiltered = 0;
    for (EventRecord event : inRange) {
      DeviceInfo device = userAgents.classify(event.userAgent());
      if (options.excludeBots() && device.bot()) {
        botsFiltered++;
        botSessions.add(event.sessionId());
        if (log.isDebugEnabled()) {
          log.debug("Excluding bot pageview session={} userAgent={}",
              event.sessionId(), Logs.truncate(event.userAgent(), MAX_LOGGED_USER_AGENT_BYTES));
        }
        continue;
      }
      humanSessions.add(event.sessionId());
      events.add(event);
      devices.add(device);
    }
    botSessions.removeAll(humanSessions);

    List<Session> sessions = new ArrayList<>(request.sessions().size());
    for (Session session : request.sessions()) {
      boolean inWindow = range == null || range.contains(session.startTime());
      if (inWindow && !botSessions.contains(session.id())) {
        sessions.add(session);
      }
    }

    List<String> paths = new ArrayList<>(events.size());
    List<String> sources = new ArrayList<>(events.size());
    List<String> mediums = new ArrayList<>(events.size());
    List<String> campaigns = new ArrayList<>();
    List<String> languages = new ArrayList<>(events.size());
    for (EventRecord event : events) {
      ReferrerInfo referrer = referrers.classify(event.referrer(), request.currentHost());
      paths.add(event.path());
      sources.add(referrer.source());
      mediums.add(referrer.medium());
      if (referrer.campaign() != null) {
        campaigns.add(referrer.campaign());
      }
      languages.add(event.language());
    }
    List<String> deviceLabels = new ArrayList<>(devices.size());
    List<String> browsers = new ArrayList<>(devices.size());
    List<String> systems = new ArrayList<>(devices.size());
    long handheld = 0;
    for (DeviceInfo device : devices) {
      deviceLabels.add(device.device().label());
      browsers.add(device.browser());
      systems.add(device.os());
      if (!device.isDesktop()) {
        handheld++;
      }
    }
    List<String> eventTypes = new ArrayList<>(request.conversions().size());
    for (ConversionEvent conversion : request.conversions()) {
      eventTypes.add(conversion.eventType());
    }

    List<AggregatedBucket> series = time.aggregate(events, request.granularity(), range);
    if (range != null && options.fillGaps()) {
      series = time.fillMissingPeriods(series, request.granularity(), range);
    }
    List<Double> pageViewSeries = new ArrayList<>(series.size());
    for (AggregatedBucket bucket : series) {
      pageViewSeries.add((double) bucket.pageViews());
    }
    AnomalyReport anomalies = calculator.detectAnomalies(pageViewSeries, options.anomalyThreshold());

    List<Double> durations = new ArrayList<>(sessions.size());
    for (Session session : sessions) {
      session.durationSeconds().ifPresent(durations::add);
    }
    PerformanceMetrics sessionDuration = calculator.performanceMetrics(durations, "session.duration");
    MetricsSummary totals = request.conversions().isEmpty()
        ? calculator.summary(events, sessions)
        : calculator.summary(events, sessions, request.conversions());

    DashboardSummary summary = new DashboardSummary(
        totals,
        top(RankedCount.rank(paths)),
        top(RankedCount.rank(sources)),
        top(RankedCount.rank(mediums)),
        top(RankedCount.rank(deviceLabels)),
        top(RankedCount.rank(browsers)),
        top(RankedCount.rank(systems)),
        top(countries(events)),
        top(RankedCount.rank(languages)),
        top(RankedCount.rank(campaigns)),
        top(RankedCount.rank(eventTypes)),
        request.granularity(),
        series,
        anomalies,
        calculator.returnVisitorRate(sessions),
        calculator.sessionQuality(sessions),
        sessionDuration,
        Rounding.percentage(handheld, devices.size()),
        botsFiltered);

    long elapsed = System.nanoTime() - started;
    metrics.observe("pulse.summary.events", events.size());
    metrics.observe("pulse.summary.bots.filtered", botsFiltered);
    metrics.observe("pulse.summary.anomalies", anomalies.anomalies().size());
    metrics.observe("pulse.summary.latencyNanos", elapsed);
    log.info("Dashboard summary computed: events={} sessions={} granularity={} buckets={} botsFiltered={} "
            + "elapsedMs={}",
        events.size(), sessions.size(), request.granularity(), series.size(), botsFiltered,
        TimeUnit.NANOSECONDS.toMillis(elapsed));
    return summary;
  }

  private List<RankedCount> countries(List<EventRecord> events) {
    List<GeoStats> byCountry = geo.aggregateByCountry(GeoLocation.fromEvents(events));
    List<RankedCount> rows = new ArrayList<>(byCountry.size());
    for (GeoStats stats : byCountry) {
      rows.add(new RankedCount(
          stats.location(), stats.pageViews(), Rounding.percentage(stats.pageViews(), events.size())));
    }
    return rows;
  }

  private List<RankedCount> top(List<RankedCount> ranked) {
    return ranked.subList(0, Math.min(options.topLimit(), ranked.size()));
  }

  /**
   * Behaviour switches of the summary.
   *
   * @param excludeBots remove bot pageviews, and sessions made only of them, before computing anything
   * @param fillGaps insert zero buckets across the reporting window
   * @param anomalyThreshold z-score limit for the series anomaly report; non-negative
   * @param topLimit rows kept per ranked breakdown; non-negative
   */
  public record Options(boolean excludeBots, boolean fillGaps, double anomalyThreshold, int topLimit) {

    public Options {
      Numbers.requireNonNegative("anomalyThreshold", anomalyThreshold);
      Numbers.requireNonNegative("topLimit", topLimit);
    }

    public static Options defaults() {
      return new Options(true, true, MetricsCalculator.DEFAULT_ANOMALY_THRESHOLD, 10);
    }
  }
}
