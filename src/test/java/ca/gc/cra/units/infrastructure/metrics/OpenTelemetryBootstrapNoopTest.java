package ca.gc.cra.units.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
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

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("policy.enforce.passed");
      adapter.observe("lineage.render.latencyNanos", 5L);
    }
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void exporterModeParsing() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(" NONE "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
  }
}
