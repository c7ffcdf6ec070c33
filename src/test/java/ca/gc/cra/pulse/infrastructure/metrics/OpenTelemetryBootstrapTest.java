package ca.gc.cra.pulse.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void invalidEndpointFallsBackToNoop() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("not-a-url", "");

    assertTrue(result.isNoop(), "Expected noop metrics bootstrap for an invalid endpoint");
    result.forceFlush();
    result.close();
  }

  @Test
  void noopAdapterAcceptsCalls() {
    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());

    adapter.increment("pulse.summary.requests");
    adapter.observe("pulse.summary.events", 3);
    adapter.close();

    NoOpMetricsAdapter noop = new NoOpMetricsAdapter();
    noop.increment("pulse.summary.requests");
    noop.observe("pulse.summary.events", 3);
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=prod, broken, =x, region=ca-central");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("ca-central", attributes.get(AttributeKey.stringKey("region")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
  }
}
