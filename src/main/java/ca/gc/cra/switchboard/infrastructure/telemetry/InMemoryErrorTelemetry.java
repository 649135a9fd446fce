package ca.gc.cra.switchboard.infrastructure.telemetry;

import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory sink used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryErrorTelemetry implements ErrorTelemetryPort {
  private final CopyOnWriteArrayList<ErrorEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void publish(ErrorEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of published events.
   *
   * @return immutable list of events in publication order
   */
  public List<ErrorEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
