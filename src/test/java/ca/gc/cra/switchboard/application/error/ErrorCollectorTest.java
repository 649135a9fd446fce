package ca.gc.cra.switchboard.application.error;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ErrorCollectorTest {
  private static final long NOW = Instant.parse("2024-05-01T12:00:00Z").toEpochMilli();

  @Test
  void failureIsStampedAndForwardedToTelemetry() {
    List<ErrorEvent> published = new ArrayList<>();
    RecordingMetrics metrics = new RecordingMetrics();
    ErrorCollector collector = new ErrorCollector(published::add, metrics, () -> NOW);
    IllegalStateException boom = new IllegalStateException("bag is empty");

    ErrorEvent event = collector.reportFailure(
        "bag-1", "MarshmallowBag", "In.onTake", boom, Map.of("count", 3));

    assertEquals(1, published.size());
    assertSame(event, published.get(0));
    assertEquals("IllegalStateException: bag is empty", event.error());
    assertSame(boom, event.cause());
    assertEquals(Instant.ofEpochMilli(NOW), event.timestamp());
    assertEquals(Map.of("count", 3), event.payload());
    assertEquals(1L, collector.collectedCount());
    assertEquals(1L, metrics.counter("errors.collected"));
  }

  @Test
  void anomalyHasNoCause() {
    List<ErrorEvent> published = new ArrayList<>();
    ErrorCollector collector = new ErrorCollector(published::add, MetricsPort.NO_OP, () -> NOW);

    ErrorEvent event = collector.reportAnomaly("ghost", ErrorEvent.UNKNOWN_CLASS, "route.sendTo",
        "No instance with id ghost", null);

    assertNull(event.cause());
    assertEquals(Map.of(), event.payload());
    assertEquals("route.sendTo", published.get(0).handler());
  }

  @Test
  void telemetryFailureIsContained() {
    RecordingMetrics metrics = new RecordingMetrics();
    ErrorTelemetryPort broken = event -> {
      throw new IllegalStateException("sink offline");
    };
    ErrorCollector collector = new ErrorCollector(broken, metrics, () -> NOW);

    collector.reportAnomaly("a", "Timer", "Sys.every", "late", Map.of());

    assertEquals(1L, collector.collectedCount());
    assertEquals(1L, metrics.counter("errors.telemetry.failed"));
  }

  @Test
  void payloadThatCannotBeRenderedIsStillCollected() {
    List<ErrorEvent> published = new ArrayList<>();
    ErrorCollector collector = new ErrorCollector(published::add, MetricsPort.NO_OP, () -> NOW);
    Object opaque = new Object() {
      @Override
      public String toString() {
        throw new UnsupportedOperationException("no text");
      }
    };
    IllegalStateException boom = new IllegalStateException("stuck");

    ErrorEvent event = assertDoesNotThrow(() ->
        collector.reportFailure("lamp-1", "Lamp", "In.onToggle", boom, Map.of("opaque", opaque)));

    assertEquals(1L, collector.collectedCount());
    assertSame(event, published.get(0));
    assertEquals("IllegalStateException: stuck", event.error());
  }

  @Test
  void nullEventIsIgnored() {
    ErrorCollector collector = new ErrorCollector(ErrorTelemetryPort.NO_OP, MetricsPort.NO_OP, () -> NOW);

    collector.handleError(null);

    assertEquals(0L, collector.collectedCount());
  }

  @Test
  void callerDiagnosticContextIsRestored() {
    ErrorCollector collector = new ErrorCollector(ErrorTelemetryPort.NO_OP, MetricsPort.NO_OP, () -> NOW);
    MDC.put("node.id", "outer");
    try {
      collector.reportAnomaly("inner", "Zone", "Sys.onInit", "bad", Map.of());
      assertEquals("outer", MDC.get("node.id"));
      assertNull(MDC.get("node.class"));
    } finally {
      MDC.clear();
    }
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new HashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {}

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }
  }
}
