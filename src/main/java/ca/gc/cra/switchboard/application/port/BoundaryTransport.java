package ca.gc.cra.switchboard.application.port;

import ca.gc.cra.switchboard.domain.node.Domain;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Abstract channel bridging two execution contexts of the same process.
 * <p><strong>Why:</strong> The router only knows that a target class lives in another domain; how the message gets
 * there (and in which wire format) belongs to the adapter.</p>
 * <p><strong>Role:</strong> Application port; adapters must deliver reliably and preserve per-sender order.</p>
 *
 * @since 0.1.0
 */
public interface BoundaryTransport {
  /**
   * Hands a signal to the other execution context.
   *
   * @param sourceClass class name of the local sender
   * @param signal signal name
   * @param payload message payload
   * @param targetDomain domain whose bus must dispatch the signal
   */
  void sendAcrossBoundary(String sourceClass, String signal, Map<String, Object> payload, Domain targetDomain);

  /**
   * Registers the local receiver that inbound signals are delivered to.
   *
   * @param receiver local bus entry point
   */
  void connect(BoundaryReceiver receiver);

  /** Transport used when no boundary is configured; drops outbound signals. */
  BoundaryTransport DISCONNECTED = new BoundaryTransport() {
    private final Logger log = LoggerFactory.getLogger(BoundaryTransport.class);

    @Override
    public void sendAcrossBoundary(
        String sourceClass, String signal, Map<String, Object> payload, Domain targetDomain) {
      log.debug("No boundary transport; dropping {} from {} for {}", signal, sourceClass, targetDomain);
    }

    @Override
    public void connect(BoundaryReceiver receiver) {}
  };
}
