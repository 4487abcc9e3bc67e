package ca.gc.cra.vigil.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.Handle handle = OpenTelemetryBootstrap.initialize();
    assertTrue(handle.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    handle.forceFlush();
    handle.close();
  }

  @Test
  void noopAdapterAcceptsUpdates() {
    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle.noop());
    adapter.increment("events.emitted");
    adapter.observe("processor.latencyNanos", 5L);
    adapter.close();
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("site=ottawa, broken, =x, lane = 3 ,");

    assertEquals(2, attributes.size());
    assertEquals("ottawa", attributes.get(AttributeKey.stringKey("site")));
    assertEquals("3", attributes.get(AttributeKey.stringKey("lane")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(" ").isEmpty());
  }
}
