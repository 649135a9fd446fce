package ca.gc.cra.switchboard.infrastructure.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingErrorTelemetryTest {
  @Test
  void publishLogsEventAndCountsIt() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingErrorTelemetry telemetry = new LoggingErrorTelemetry(metrics, "nodeErrors");

    List<ILoggingEvent> events = capture(() -> telemetry.publish(new ErrorEvent(
        "dispenser-1",
        "Dispenser",
        "In.onDispense",
        "IllegalStateException: jammed",
        new IllegalStateException("jammed"),
        Map.of("slot", 4, "token", "abc123"),
        Instant.parse("2024-01-01T00:00:00Z"))));

    assertEquals(1L, metrics.counter("nodeErrors.published"));
    assertEquals(1, events.size());
    String message = events.get(0).getFormattedMessage();
    assertTrue(message.startsWith("node.telemetry instance=dispenser-1, class=Dispenser, handler=In.onDispense"));
    assertTrue(message.contains("cause=java.lang.IllegalStateException"));
    assertTrue(message.contains("slot=4"));
    assertTrue(message.contains("token=[REDACTED]"));
    assertFalse(message.contains("abc123"));
    assertTrue(message.endsWith("timestamp=2024-01-01T00:00:00Z"));
  }

  @Test
  void anomalyWithoutCauseOrPayloadOmitsThoseFields() {
    LoggingErrorTelemetry telemetry = new LoggingErrorTelemetry(null);

    List<ILoggingEvent> events = capture(() -> telemetry.publish(new ErrorEvent(
        "ghost",
        ErrorEvent.UNKNOWN_CLASS,
        "route.sendTo",
        "No instance with id ghost",
        null,
        null,
        Instant.parse("2024-01-01T00:00:00Z"))));

    String message = events.get(0).getFormattedMessage();
    assertFalse(message.contains("cause="));
    assertFalse(message.contains("payload="));
  }

  @Test
  void publishRejectsNullEvent() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingErrorTelemetry telemetry = new LoggingErrorTelemetry(metrics);

    assertThrows(NullPointerException.class, () -> telemetry.publish(null));
    assertEquals(0L, metrics.counter("telemetry.published"));
  }

  private static List<ILoggingEvent> capture(Runnable action) {
    Logger logger = (Logger) LoggerFactory.getLogger(LoggingErrorTelemetry.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    Level originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
    appender.start();
    logger.addAppender(appender);
    try {
      action.run();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }
    return appender.list;
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
