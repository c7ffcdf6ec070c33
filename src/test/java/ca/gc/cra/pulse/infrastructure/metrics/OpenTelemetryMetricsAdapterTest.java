package ca.gc.cra.pulse.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap =
        OpenTelemetryBootstrap.forTesting(reader, "deployment.environment=test");
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private Optional<MetricData> metric(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  @Test
  void incrementRecordsCounterWithKeyAttributeAndResource() {
    adapter.increment("pulse.summary.requests");
    adapter.increment("pulse.summary.requests");
    adapter.forceFlush();

    MetricData counter = metric("pulse.summary.requests").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("pulse.summary.requests", point.getAttributes().get(AttributeKey.stringKey("pulse.metric.key")));

    assertEquals("pulse", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertEquals("test", counter.getResource().getAttribute(AttributeKey.stringKey("deployment.environment")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("pulse.summary.latencyNanos", 1_500);
    adapter.observe("pulse.summary.latencyNanos", 2_500);
    adapter.forceFlush();

    MetricData histogram = metric("pulse.summary.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
    assertEquals("pulse.summary.latencyNanos",
        point.getAttributes().get(AttributeKey.stringKey("pulse.metric.key")));
  }

  @Test
  void sanitizeNameReplacesRejectedCharacters() {
    assertEquals("pulse.bots_filtered", OpenTelemetryMetricsAdapter.sanitizeName("Pulse.Bots Filtered"));
    assertEquals("m1.latency", OpenTelemetryMetricsAdapter.sanitizeName("1.latency"));
    assertEquals("pulse.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
