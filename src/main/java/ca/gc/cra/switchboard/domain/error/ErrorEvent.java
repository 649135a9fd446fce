package ca.gc.cra.switchboard.domain.error;

import ca.gc.cra.switchboard.domain.node.Message;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Structured record describing a handler failure or routing anomaly.
 * <p><strong>Why:</strong> Live message flow never throws past the router; failures travel as data to the error
 * collector and any telemetry collaborator instead.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param instanceId instance that failed or was addressed
 * @param className class of the instance, or {@code <unknown>} for unresolved targets
 * @param handler qualified handler or operation (e.g., {@code In.onFired})
 * @param error human-readable error summary
 * @param cause underlying exception, or {@code null} for anomalies
 * @param payload payload of the message being handled
 * @param timestamp time the failure was recorded
 * @since 0.1.0
 */
public record ErrorEvent(
    String instanceId,
    String className,
    String handler,
    String error,
    Throwable cause,
    Map<String, Object> payload,
    Instant timestamp) {

  /** Placeholder used when the class of an addressed instance cannot be resolved. */
  public static final String UNKNOWN_CLASS = "<unknown>";

  /**
   * Validates required fields and copies the payload.
   */
  public ErrorEvent {
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(className, "className");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(error, "error");
    Objects.requireNonNull(timestamp, "timestamp");
    payload = Message.copyPayload(payload);
  }

  /**
   * Indicates whether the event wraps a thrown exception.
   *
   * @return {@code true} when {@link #cause()} is present
   */
  public boolean hasCause() {
    return cause != null;
  }
}
