package ca.gc.cra.pulse.application.summary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.classify.ReferrerClassifier;
import ca.gc.cra.pulse.application.classify.UserAgentClassifier;
import ca.gc.cra.pulse.application.geo.GeoAggregator;
import ca.gc.cra.pulse.application.metrics.MetricsCalculator;
import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.time.TimePeriodAggregator;
import ca.gc.cra.pulse.domain.metrics.MetricsSummary;
import ca.gc.cra.pulse.domain.metrics.PerformanceMetrics;
import ca.gc.cra.pulse.domain.stats.RankedCount;
import ca.gc.cra.pulse.domain.time.AggregatedBucket;
import ca.gc.cra.pulse.domain.time.Granularity;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DashboardSummaryUseCaseTest {

  private static DashboardSummaryUseCase useCase(DashboardSummaryUseCase.Options options, MetricsPort metrics) {
    return new DashboardSummaryUseCase(
        new UserAgentClassifier(),
        new ReferrerClassifier(),
        new GeoAggregator(),
        new TimePeriodAggregator(),
        new MetricsCalculator(),
        options,
        metrics);
  }

  private static List<String> labels(List<RankedCount> rows) {
    return rows.stream().map(RankedCount::label).collect(Collectors.toList());
  }

  @Test
  void summarizesWindowWithoutBots() {
    DashboardSummary summary =
        useCase(DashboardSummaryUseCase.Options.defaults(), MetricsPort.NO_OP).summarize(SummaryFixtures.request());

    MetricsSummary totals = summary.totals();
    assertEquals(3, totals.totalPageViews());
    assertEquals(2, totals.uniqueVisitors());
    assertEquals(2, totals.totalSessions());
    assertEquals(50.0, totals.bounceRate());
    assertEquals(465, totals.avgSessionDuration());
    assertEquals(1.5, totals.avgPageViewsPerSession());
    assertEquals(50.0, totals.conversionRate());
    assertEquals(1, summary.botsFiltered());

    assertEquals(List.of(new RankedCount("/", 2, 66.7), new RankedCount("/pricing", 1, 33.3)), summary.pages());
    assertEquals(List.of("google", "example.com", "(direct)"), labels(summary.sources()));
    assertEquals(List.of("search", "internal", "direct"), labels(summary.mediums()));
    assertEquals(new RankedCount("Mobile", 2, 66.7), summary.devices().get(0));
    assertEquals(List.of("Safari", "Chrome"), labels(summary.browsers()));
    assertEquals(List.of("iOS", "macOS"), labels(summary.operatingSystems()));
    assertEquals(new RankedCount("Canada", 2, 66.7), summary.countries().get(0));
    assertEquals(List.of(new RankedCount("en-CA", 1, 33.3)), summary.languages());
    assertTrue(summary.campaigns().isEmpty());
    assertEquals(List.of(new RankedCount("signup", 1, 100.0)), summary.events());
    assertEquals(66.7, summary.mobilePercentage());
    assertEquals(0.0, summary.returnVisitorRate());
  }

  @Test
  void seriesIsFilledAcrossTheWindow() {
    DashboardSummary summary =
        useCase(DashboardSummaryUseCase.Options.defaults(), MetricsPort.NO_OP).summarize(SummaryFixtures.request());

    List<AggregatedBucket> series = summary.series();
    assertEquals(24, series.size());
    assertEquals(new AggregatedBucket(Instant.parse("2024-03-06T10:00:00Z"), 3, 2, 2), series.get(10));
    assertTrue(series.get(11).isEmpty());
    assertEquals(Granularity.hour(), summary.granularity());
    assertEquals(List.of(3.0), summary.anomalies().anomalies());
  }

  @Test
  void sessionDurationPercentiles() {
    DashboardSummary summary =
        useCase(DashboardSummaryUseCase.Options.defaults(), MetricsPort.NO_OP).summarize(SummaryFixtures.request());

    assertEquals(new PerformanceMetrics("session.duration", 465.0, 465.0, 682.5, 856.5), summary.sessionDuration());
  }

  @Test
  void botsAreKeptWhenExclusionDisabled() {
    DashboardSummaryUseCase.Options options = new DashboardSummaryUseCase.Options(false, false, 2.0, 10);

    DashboardSummary summary = useCase(options, MetricsPort.NO_OP).summarize(SummaryFixtures.request());

    assertEquals(4, summary.totals().totalPageViews());
    assertEquals(3, summary.totals().totalSessions());
    assertEquals(0, summary.botsFiltered());
    assertEquals(2, summary.series().size());
  }

  @Test
  void topLimitTruncatesBreakdowns() {
    DashboardSummaryUseCase.Options options = new DashboardSummaryUseCase.Options(true, true, 2.0, 1);

    DashboardSummary summary = useCase(options, MetricsPort.NO_OP).summarize(SummaryFixtures.request());

    assertEquals(1, summary.pages().size());
    assertEquals(1, summary.sources().size());
    assertEquals(3, summary.totals().totalPageViews());
  }

  @Test
  void withoutRangeOrConversionsEverythingCounts() {
    SummaryRequest request = SummaryRequest.of(
        SummaryFixtures.events(), SummaryFixtures.sessions(), Granularity.day());

    DashboardSummary summary = useCase(DashboardSummaryUseCase.Options.defaults(), MetricsPort.NO_OP)
        .summarize(request);

    assertEquals(4, summary.totals().totalPageViews());
    assertEquals(3, summary.totals().totalSessions());
    assertNull(summary.totals().conversionRate());
    assertEquals(2, summary.series().size());
    assertTrue(labels(summary.sources()).contains("example.com"));
    assertTrue(labels(summary.mediums()).contains("referral"));
  }

  @Test
  void emptyInputYieldsZeroMetrics() {
    SummaryRequest request = SummaryRequest.of(List.of(), List.of(), Granularity.hour());

    DashboardSummary summary = useCase(DashboardSummaryUseCase.Options.defaults(), MetricsPort.NO_OP)
        .summarize(request);

    assertEquals(0, summary.totals().totalPageViews());
    assertEquals(0.0, summary.totals().bounceRate());
    assertTrue(summary.series().isEmpty());
    assertTrue(summary.pages().isEmpty());
    assertEquals(0.0, summary.mobilePercentage());
  }

  @Test
  void emitsMetricsAndOneInfoLine() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    DashboardSummaryUseCase useCase = useCase(DashboardSummaryUseCase.Options.defaults(), metrics);

    Logger logger = (Logger) LoggerFactory.getLogger(DashboardSummaryUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      useCase.summarize(SummaryFixtures.request());
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(1, metrics.count("pulse.summary.requests"));
    assertEquals(List.of(3L), metrics.observed("pulse.summary.events"));
    assertEquals(List.of(1L), metrics.observed("pulse.summary.bots.filtered"));
    assertEquals(List.of(1L), metrics.observed("pulse.summary.anomalies"));
    assertEquals(1, metrics.observed("pulse.summary.latencyNanos").size());

    List<ILoggingEvent> infos = appender.list.stream()
        .filter(event -> event.getLevel() == Level.INFO)
        .collect(Collectors.toList());
    assertEquals(1, infos.size());
    String message = infos.get(0).getFormattedMessage();
    assertTrue(message.startsWith("Dashboard summary computed: events=3 sessions=2 granularity=hour buckets=24"));
    assertTrue(message.contains("botsFiltered=1"));
  }

  @Test
  void optionsRejectNegativeLimits() {
    assertThrows(IllegalArgumentException.class, () -> new DashboardSummaryUseCase.Options(true, true, 2.0, -1));
    assertThrows(IllegalArgumentException.class, () -> new DashboardSummaryUseCase.Options(true, true, -0.5, 10));
  }
}
