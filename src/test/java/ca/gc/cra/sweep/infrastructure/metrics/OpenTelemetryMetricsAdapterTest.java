package ca.gc.cra.sweep.infrastructure.metrics;

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

  @Test
  void incrementRecordsCounterWithKeyAttributeAndResource() {
    adapter.increment("sweep.scenario.executed");
    adapter.increment("sweep.scenario.executed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "sweep.scenario.executed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("sweep.scenario.executed", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
    assertEquals("sweep", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsLatencyHistogramInMilliseconds() {
    adapter.observe("sweep.scenario.latencyMillis", 1_000L);
    adapter.observe("sweep.scenario.latencyMillis", 3_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "sweep.scenario.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }

  @Test
  void sanitizeNameKeepsInstrumentNamesValid() {
    assertEquals("sweep.heartbeat.emitted", OpenTelemetryMetricsAdapter.sanitizeName("sweep.heartbeat.emitted"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitizeName("9 lives"));
    assertEquals("sweep.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("1", OpenTelemetryMetricsAdapter.unitFor("sweep.preflight.blocked"));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> metric = metrics.stream()
        .filter(candidate -> candidate.getName().equals(name))
        .findFirst();
    assertTrue(metric.isPresent(), "Expected metric " + name + " to be exported");
    return metric.orElseThrow();
  }
}
