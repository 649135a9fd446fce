package ca.gc.cra.switchboard.infrastructure.metrics;

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
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("switchboard.metric.key");

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
  void incrementRecordsCounterWithResourceAttributes() {
    adapter.increment("router.message.delivered");
    adapter.increment("router.message.delivered");
    adapter.increment("router.message.delivered");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "router.message.delivered").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("router.message.delivered", point.getAttributes().get(KEY_ATTRIBUTE));

    assertEquals("switchboard", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void mixedCaseKeysAreLowercasedButKeptInAttribute() {
    adapter.increment("router.message.cycleDropped");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "router.message.cycledropped").orElseThrow();
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("router.message.cycleDropped", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("router.dispatch.latencyNanos", 1_000L);
    adapter.observe("router.dispatch.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "router.dispatch.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum(), 0.0001);
  }

  @Test
  void keysThatAreNotInstrumentNamesAreSanitized() {
    adapter.increment("9 lives");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "m9_lives").orElseThrow();
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("9 lives", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
