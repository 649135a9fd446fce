package ca.gc.cra.switchboard.application.node;

import ca.gc.cra.switchboard.domain.node.Message;

/**
 * Handler bound to a pin of a node class.
 *
 * <p>Exceptions thrown here never escape the router; they become error events.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SignalHandler {
  /**
   * Handles one message delivered to {@code node}.
   *
   * @param node instance receiving the message
   * @param message delivered message
   * @throws Exception any failure; isolated and reported by the router
   */
  void handle(NodeContext node, Message message) throws Exception;

  /** Handler that does nothing; used for the root lifecycle defaults. */
  SignalHandler NO_OP = (node, message) -> {};
}
