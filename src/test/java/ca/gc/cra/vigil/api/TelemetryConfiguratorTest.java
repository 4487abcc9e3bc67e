package ca.gc.cra.vigil.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  private final Map<String, String> saved = new HashMap<>();

  @BeforeEach
  void saveProperties() {
    for (String property : PROPERTIES) {
      saved.put(property, System.getProperty(property));
    }
  }

  @AfterEach
  void restoreProperties() {
    saved.forEach((property, value) -> {
      if (value == null) {
        System.clearProperty(property);
      } else {
        System.setProperty(property, value);
      }
    });
  }

  @Test
  void setsOpenTelemetryProperties() {
    TelemetryConfigurator.configureMetrics(Map.of(
        "metricsExporter", " NONE ",
        "otelEndpoint", "http://collector:4318",
        "otelResourceAttributes", "deployment.environment=test"));

    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4318", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
  }

  @Test
  void blankValuesLeavePropertiesAlone() {
    System.setProperty("otel.metrics.exporter", "otlp");

    TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "", "otelEndpoint", " "));

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void rejectsUnknownExporter() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "prometheus")));
  }

  @Test
  void rejectsEndpointWithoutHttpScheme() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("otelEndpoint", "ftp://collector:21")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("otelEndpoint", "http://")));
  }
}
