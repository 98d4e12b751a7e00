package ca.gc.cra.units.infrastructure.metrics;

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
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  private Optional<MetricData> find(String name) {
    Collection<MetricData> metrics = reader.collectAllMetrics();
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("policy.enforce.converted");
    adapter.increment("policy.enforce.converted");
    adapter.increment("policy.enforce.converted");
    adapter.forceFlush();

    MetricData counter = find("policy.enforce.converted").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("policy.enforce.converted",
        point.getAttributes().get(AttributeKey.stringKey("units.metric.key")));
    assertEquals("unit-audit", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("lineage.render.latencyNanos", 1_000L);
    adapter.observe("lineage.render.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = find("lineage.render.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("policy.enforce.passed", OpenTelemetryMetricsAdapter.sanitizeName("policy.enforce.passed"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("a b"));
    assertEquals("units.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
    assertTrue(OpenTelemetryMetricsAdapter.sanitizeName("Render/Time").startsWith("render_time"));
  }
}
