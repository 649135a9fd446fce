package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.node.HandlerNotFoundException;
import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.application.node.SignalHandler;
import ca.gc.cra.switchboard.domain.node.Channel;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Resolves which implementation answers a handler name under the active mode.
 * <p><strong>Order:</strong> the active mode's override, then each base mode's override (nearest first), then the
 * class handler, then the inherited default.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class PinResolver {
  private PinResolver() {
    // Utility
  }

  /**
   * Finds a handler without failing.
   *
   * @param nodeClass class of the receiving instance
   * @param channel pin
   * @param handlerName handler identifier
   * @param lineage active mode followed by its bases; empty when no mode is active
   * @return handler, or empty when nothing implements it
   */
  public static Optional<SignalHandler> find(
      NodeClass nodeClass, Channel channel, String handlerName, List<String> lineage) {
    for (String mode : lineage) {
      Optional<SignalHandler> override = nodeClass.modeHandler(mode, channel, handlerName);
      if (override.isPresent()) {
        return override;
      }
    }
    return nodeClass.handler(channel, handlerName);
  }

  /**
   * Resolves a handler.
   *
   * @param nodeClass class of the receiving instance
   * @param channel pin
   * @param handlerName handler identifier
   * @param lineage active mode followed by its bases
   * @return handler
   * @throws HandlerNotFoundException when nothing implements it
   */
  public static SignalHandler resolve(
      NodeClass nodeClass, Channel channel, String handlerName, List<String> lineage) {
    return find(nodeClass, channel, handlerName, lineage)
        .orElseThrow(() -> new HandlerNotFoundException(nodeClass.name(), channel.qualify(handlerName)));
  }
}
