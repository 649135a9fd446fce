package ca.gc.cra.switchboard.infrastructure.telemetry;

import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import ca.gc.cra.switchboard.logging.Logs;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes error events as structured {@code node.telemetry} log lines and counts them.
 *
 * <p>Log under a dedicated logger so operators can route telemetry to its own appender.</p>
 *
 * @since 0.1.0
 */
public final class LoggingErrorTelemetry implements ErrorTelemetryPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingErrorTelemetry.class);
  private static final int MAX_PAYLOAD_BYTES = 1024;

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a logging sink.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code telemetry})
   */
  public LoggingErrorTelemetry(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "telemetry" : metricPrefix.trim();
  }

  /**
   * Creates a logging sink using {@code telemetry} as the metric prefix.
   *
   * @param metrics metrics adapter
   */
  public LoggingErrorTelemetry(MetricsPort metrics) {
    this(metrics, "telemetry");
  }

  @Override
  public void publish(ErrorEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".published");

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("instance=" + event.instanceId());
    joiner.add("class=" + event.className());
    joiner.add("handler=" + event.handler());
    joiner.add("error=" + event.error());
    if (event.hasCause()) {
      joiner.add("cause=" + event.cause().getClass().getName());
    }
    if (!event.payload().isEmpty()) {
      joiner.add("payload=" + Logs.payload(event.payload(), MAX_PAYLOAD_BYTES));
    }
    joiner.add("timestamp=" + event.timestamp());

    log.info("node.telemetry {}", joiner);
  }
}
