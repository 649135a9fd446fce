package ca.gc.cra.switchboard.infrastructure.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class AsyncErrorTelemetryTest {
  @Test
  void closeDrainsQueuedEventsInOrderAndClosesDelegate() {
    AtomicBoolean delegateClosed = new AtomicBoolean();
    InMemoryErrorTelemetry sink = new InMemoryErrorTelemetry();
    ErrorTelemetryPort closing = new ErrorTelemetryPort() {
      @Override
      public void publish(ErrorEvent event) {
        sink.publish(event);
      }

      @Override
      public void close() {
        delegateClosed.set(true);
      }
    };
    AsyncErrorTelemetry telemetry = new AsyncErrorTelemetry(closing, null);

    for (int i = 0; i < 50; i++) {
      telemetry.publish(event("n" + i));
    }
    telemetry.close();

    List<ErrorEvent> published = sink.snapshot();
    assertEquals(50, published.size());
    assertEquals("n0", published.get(0).instanceId());
    assertEquals("n49", published.get(49).instanceId());
    assertTrue(delegateClosed.get());
  }

  @Test
  void delegateFailuresAreCountedAndDoNotStopTheWorker() {
    RecordingMetrics metrics = new RecordingMetrics();
    InMemoryErrorTelemetry sink = new InMemoryErrorTelemetry();
    AsyncErrorTelemetry telemetry = new AsyncErrorTelemetry(event -> {
      if (event.instanceId().equals("bad")) {
        throw new IllegalStateException("sink down");
      }
      sink.publish(event);
    }, metrics);

    telemetry.publish(event("bad"));
    telemetry.publish(event("good"));
    telemetry.close();

    assertEquals(1L, metrics.counter("telemetry.async.failed"));
    assertEquals(1, sink.snapshot().size());
  }

  @Test
  void eventsAfterCloseAreDropped() {
    RecordingMetrics metrics = new RecordingMetrics();
    InMemoryErrorTelemetry sink = new InMemoryErrorTelemetry();
    AsyncErrorTelemetry telemetry = new AsyncErrorTelemetry(sink, metrics);
    telemetry.close();

    telemetry.publish(event("late"));

    assertEquals(1L, metrics.counter("telemetry.async.dropped"));
    assertTrue(sink.snapshot().isEmpty());
  }

  private static ErrorEvent event(String instanceId) {
    return new ErrorEvent(instanceId, "Dispenser", "In.onDispense", "boom", null, Map.of(), Instant.EPOCH);
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {}

    long counter(String key) {
      AtomicLong value = counters.get(key);
      return value == null ? 0L : value.get();
    }
  }
}
