package ca.gc.cra.trace.infrastructure.metrics;

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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("trace.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap = OpenTelemetryBootstrap.forTesting(reader);
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("trace.diagnostics.orphan");
    adapter.increment("trace.diagnostics.orphan");
    adapter.increment("trace.diagnostics.orphan");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "trace.diagnostics.orphan").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("trace.diagnostics.orphan", point.getAttributes().get(METRIC_KEY));

    assertEquals("trace", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("trace.build.latencyMs", 10L);
    adapter.observe("trace.build.latencyMs", 20L);
    adapter.observe("trace.build.latencyMs", 30L);
    adapter.forceFlush();

    Optional<MetricData> maybeHistogram = find(reader.collectAllMetrics(), "trace.build.latencyms");
    assertTrue(maybeHistogram.isPresent(), "Expected histogram metric to be exported");

    MetricData histogram = maybeHistogram.orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(3L, point.getCount());
    assertEquals(60.0, point.getSum());
    assertEquals("trace.build.latencyMs", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameLowercasesAndReplacesIllegalCharacters() {
    assertEquals("trace.diagnostics.duplicate_id", OpenTelemetryMetricsAdapter.sanitizeName("trace.diagnostics.DUPLICATE_ID"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("trace.graph_nodes", OpenTelemetryMetricsAdapter.sanitizeName("trace.graph nodes"));
    assertEquals("trace.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
