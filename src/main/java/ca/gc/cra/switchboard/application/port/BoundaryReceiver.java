package ca.gc.cra.switchboard.application.port;

import java.util.Map;

/**
 * Inbound side of the cross-boundary channel, implemented by the bus.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BoundaryReceiver {
  /**
   * Re-enters local dispatch for a signal fired by a class living in the other execution context.
   *
   * @param sourceClass class name of the remote sender
   * @param signal signal name
   * @param payload message payload
   */
  void onReceiveFromBoundary(String sourceClass, String signal, Map<String, Object> payload);
}
