package ca.gc.cra.pulse.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.summary.DashboardSummary;
import ca.gc.cra.pulse.application.summary.SummaryFixtures;
import java.time.DayOfWeek;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void defaultEngineSummarizesWithoutExporter() throws Exception {
    try (AnalyticsEngine engine = new CompositionRoot(EngineConfig.defaults()).engine()) {
      DashboardSummary summary = engine.summarize(SummaryFixtures.request());

      assertEquals(3, summary.totals().totalPageViews());
      assertEquals(1, summary.botsFiltered());
      assertEquals(DayOfWeek.SUNDAY, engine.timePeriods().weekStart());
    }
  }

  @Test
  void configFlowsIntoComponents() throws Exception {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        EngineConfig.WEEK_START, "monday",
        EngineConfig.BOTS_EXCLUDE, "false",
        EngineConfig.TOP_LIMIT, "1"));

    try (AnalyticsEngine engine = new CompositionRoot(config).engine(MetricsPort.NO_OP)) {
      DashboardSummary summary = engine.summarize(SummaryFixtures.request());

      assertEquals(DayOfWeek.MONDAY, engine.timePeriods().weekStart());
      assertEquals(0, summary.botsFiltered());
      assertEquals(1, summary.pages().size());
      assertEquals(config, engine.config());
    }
  }

  @Test
  void engineExposesComponentsAndJson() throws Exception {
    try (AnalyticsEngine engine = new CompositionRoot(EngineConfig.defaults()).engine(MetricsPort.NO_OP)) {
      assertEquals("Safari", engine.userAgents().classify(SummaryFixtures.IPHONE).browser());
      assertEquals("search", engine.referrers().classifyMedium("https://www.bing.com/?q=pulse"));
      assertEquals(0.0, engine.metrics().bounceRate(List.of()));
      assertTrue(engine.geo().isValidCoordinates(0, 0));
      assertTrue(engine.timeSeries().fillGaps(List.of(), 5).isEmpty());

      String json = engine.summarizeJson(SummaryFixtures.request());
      assertTrue(json.startsWith("{\"totals\":{\"totalPageViews\":3"));
    }
  }

  @Test
  void otlpExporterWithUnreachableEndpointStillBuilds() throws Exception {
    Map<String, String> values = new HashMap<>();
    values.put(EngineConfig.METRICS_EXPORTER, "otlp");
    values.put(EngineConfig.METRICS_ENDPOINT, "not-a-url");

    try (AnalyticsEngine engine = new CompositionRoot(EngineConfig.fromMap(values)).engine()) {
      assertEquals(3, engine.summarize(SummaryFixtures.request()).totals().totalPageViews());
    }
  }
}
