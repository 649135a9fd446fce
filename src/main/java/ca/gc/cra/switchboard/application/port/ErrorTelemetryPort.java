package ca.gc.cra.switchboard.application.port;

import ca.gc.cra.switchboard.domain.error.ErrorEvent;

/**
 * <strong>What:</strong> External collaborator receiving copies of collected error events.
 * <p><strong>Why:</strong> Keeps telemetry backends outside the bus while still giving them every failure.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from the dispatch thread; they must not
 * block it for long.</p>
 *
 * @since 0.1.0
 */
public interface ErrorTelemetryPort extends AutoCloseable {
  /**
   * Publishes an error event.
   *
   * @param event structured error record; never {@code null}
   */
  void publish(ErrorEvent event);

  /**
   * Releases resources held by the telemetry sink.
   */
  @Override
  default void close() {}

  /** Telemetry sink that drops every event. */
  ErrorTelemetryPort NO_OP = event -> {};
}
