package ca.gc.cra.switchboard.infrastructure.transport;

import ca.gc.cra.switchboard.application.port.BoundaryReceiver;
import ca.gc.cra.switchboard.application.port.BoundaryTransport;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.Message;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loopback link joining a server bus and a client bus in the same JVM.
 * <p><strong>Why:</strong> Exercises cross-context routing without a real wire: each endpoint hands signals to the
 * receiver connected on the other side.</p>
 * <p><strong>Delivery:</strong> Synchronous and in order; payloads are copied so the two buses never share a
 * mutable map.</p>
 * <p><strong>Thread-safety:</strong> Endpoints may be used from either bus; receivers are published safely.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryBoundaryLink {
  private static final Logger log = LoggerFactory.getLogger(InMemoryBoundaryLink.class);

  private final Map<Domain, Endpoint> endpoints = new EnumMap<>(Domain.class);

  public InMemoryBoundaryLink() {
    endpoints.put(Domain.SERVER, new Endpoint(Domain.SERVER));
    endpoints.put(Domain.CLIENT, new Endpoint(Domain.CLIENT));
  }

  /**
   * Returns the endpoint a bus running in {@code context} should use as its transport.
   *
   * @param context {@link Domain#SERVER} or {@link Domain#CLIENT}
   * @return transport endpoint
   */
  public BoundaryTransport endpoint(Domain context) {
    Endpoint endpoint = endpoints.get(Objects.requireNonNull(context, "context"));
    if (endpoint == null) {
      throw new IllegalArgumentException("No endpoint for " + context);
    }
    return endpoint;
  }

  private final class Endpoint implements BoundaryTransport {
    private final Domain side;
    private volatile BoundaryReceiver receiver;

    private Endpoint(Domain side) {
      this.side = side;
    }

    @Override
    public void sendAcrossBoundary(
        String sourceClass, String signal, Map<String, Object> payload, Domain targetDomain) {
      Endpoint peer = endpoints.get(targetDomain);
      if (peer == null || peer == this) {
        throw new IllegalArgumentException(side + " endpoint cannot deliver to " + targetDomain);
      }
      BoundaryReceiver target = peer.receiver;
      if (target == null) {
        log.warn("Dropping {} from {}: no {} bus connected", signal, sourceClass, targetDomain);
        return;
      }
      log.debug("Boundary {} -> {}: {} from {}", side, targetDomain, signal, sourceClass);
      target.onReceiveFromBoundary(sourceClass, signal, Message.copyPayload(payload));
    }

    @Override
    public void connect(BoundaryReceiver receiver) {
      this.receiver = Objects.requireNonNull(receiver, "receiver");
      log.debug("{} endpoint connected", side);
    }
  }
}
