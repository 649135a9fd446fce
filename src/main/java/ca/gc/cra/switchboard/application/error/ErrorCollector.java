package ca.gc.cra.switchboard.application.error;

import ca.gc.cra.switchboard.application.port.ClockPort;
import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import ca.gc.cra.switchboard.logging.Logs;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Single sink for handler failures and routing anomalies.
 * <p><strong>Why:</strong> Failures during live message flow must never interrupt the bus; they are reported here
 * and nowhere else.</p>
 * <p><strong>Role:</strong> Application service called by the router and by the nodes' Error pins.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write one structured {@code node.error} log line per event.</li>
 *   <li>Count events and telemetry failures.</li>
 *   <li>Forward a copy to the telemetry collaborator.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the counter is atomic.</p>
 * <p><strong>Observability:</strong> Metrics {@code errors.collected} and {@code errors.telemetry.failed}; MDC keys
 * {@code node.id} and {@code node.class} on the log line.</p>
 *
 * @implNote No retries: recovery belongs to the node that failed.
 * @since 0.1.0
 */
public final class ErrorCollector {
  private static final Logger log = LoggerFactory.getLogger(ErrorCollector.class);
  private static final int MAX_PAYLOAD_LOG_BYTES = 512;
  private static final String UNRENDERABLE_PAYLOAD = "<unrenderable>";

  private final ErrorTelemetryPort telemetry;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AtomicLong collected = new AtomicLong();

  /**
   * Creates a collector.
   *
   * @param telemetry telemetry collaborator; {@code null} falls back to {@link ErrorTelemetryPort#NO_OP}
   * @param metrics metrics port; {@code null} falls back to {@link MetricsPort#NO_OP}
   * @param clock clock used to stamp events; {@code null} falls back to {@link ClockPort#SYSTEM}
   */
  public ErrorCollector(ErrorTelemetryPort telemetry, MetricsPort metrics, ClockPort clock) {
    this.telemetry = telemetry == null ? ErrorTelemetryPort.NO_OP : telemetry;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Records an event. Never throws.
   *
   * @param event error record; a {@code null} event is logged and ignored
   */
  public void handleError(ErrorEvent event) {
    if (event == null) {
      log.warn("Ignoring null error event");
      return;
    }
    collected.incrementAndGet();
    metrics.increment("errors.collected");
    try {
      logEvent(event);
    } catch (RuntimeException ex) {
      log.warn("Could not log error event for {}", event.instanceId(), ex);
    }
    try {
      telemetry.publish(event);
    } catch (RuntimeException ex) {
      metrics.increment("errors.telemetry.failed");
      log.warn("Error telemetry rejected event for {}", event.instanceId(), ex);
    }
  }

  /**
   * Records a failure thrown by a handler.
   *
   * @param instanceId failing instance
   * @param className class of the failing instance
   * @param handler qualified handler such as {@code In.onFired}
   * @param error thrown exception
   * @param payload payload being handled
   * @return the recorded event
   */
  public ErrorEvent reportFailure(
      String instanceId, String className, String handler, Throwable error, Map<String, Object> payload) {
    Objects.requireNonNull(error, "error");
    ErrorEvent event = new ErrorEvent(
        instanceId, className, handler, describe(error), error, payload, now());
    handleError(event);
    return event;
  }

  /**
   * Records a routing anomaly that involves no exception, such as a send to an unknown instance.
   *
   * @param instanceId instance involved
   * @param className its class, or {@link ErrorEvent#UNKNOWN_CLASS}
   * @param operation operation that failed (e.g., {@code route.sendTo})
   * @param reason human-readable reason
   * @param payload payload being routed
   * @return the recorded event
   */
  public ErrorEvent reportAnomaly(
      String instanceId, String className, String operation, String reason, Map<String, Object> payload) {
    ErrorEvent event = new ErrorEvent(instanceId, className, operation, reason, null, payload, now());
    handleError(event);
    return event;
  }

  /**
   * Number of events recorded since construction.
   *
   * @return event count
   */
  public long collectedCount() {
    return collected.get();
  }

  private void logEvent(ErrorEvent event) {
    String previousId = MDC.get("node.id");
    String previousClass = MDC.get("node.class");
    try {
      MDC.put("node.id", event.instanceId());
      MDC.put("node.class", event.className());
      String payload = renderPayload(event);
      if (event.hasCause()) {
        log.error("node.error instance={} class={} handler={} error={} payload={}",
            event.instanceId(), event.className(), event.handler(), event.error(), payload, event.cause());
      } else {
        log.error("node.error instance={} class={} handler={} error={} payload={}",
            event.instanceId(), event.className(), event.handler(), event.error(), payload);
      }
    } finally {
      restore("node.id", previousId);
      restore("node.class", previousClass);
    }
  }

  private static String renderPayload(ErrorEvent event) {
    try {
      return Logs.payload(event.payload(), MAX_PAYLOAD_LOG_BYTES);
    } catch (RuntimeException ex) {
      log.warn("Payload of error event for {} could not be rendered: {}", event.instanceId(), ex.toString());
      return UNRENDERABLE_PAYLOAD;
    }
  }

  private Instant now() {
    return Instant.ofEpochMilli(clock.nowMillis());
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank()
        ? error.getClass().getSimpleName()
        : error.getClass().getSimpleName() + ": " + message;
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
