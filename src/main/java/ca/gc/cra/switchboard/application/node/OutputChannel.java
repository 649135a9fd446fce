package ca.gc.cra.switchboard.application.node;

import ca.gc.cra.switchboard.domain.node.Message;
import ca.gc.cra.switchboard.domain.node.SignalReply;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Output pin of a node: the only way a node talks to other nodes.
 *
 * @since 0.1.0
 */
public interface OutputChannel {
  /**
   * Fires a new signal through the active wiring under a freshly minted message id.
   *
   * @param signal signal name
   * @param payload payload; may be {@code null}
   */
  void fire(String signal, Map<String, Object> payload);

  /**
   * Fires a new signal with an empty payload.
   *
   * @param signal signal name
   */
  default void fire(String signal) {
    fire(signal, Map.of());
  }

  /**
   * Relays a received message through the active wiring, keeping its id so cycle tracking spans the hop.
   *
   * @param message message to forward
   */
  void forward(Message message);

  /**
   * Sends a new signal directly to one instance, bypassing wiring.
   *
   * @param targetId instance id
   * @param signal signal name
   * @param payload payload; may be {@code null}
   */
  void fireTo(String targetId, String signal, Map<String, Object> payload);

  /**
   * Relays a received message directly to one instance, keeping its id.
   *
   * @param targetId instance id
   * @param message message to forward
   */
  void forwardTo(String targetId, Message message);

  /**
   * Fires through the wiring and locks this node until the first target acknowledges or the timeout elapses.
   *
   * @param signal signal name
   * @param payload payload; may be {@code null}
   * @param timeout maximum wait
   * @return future completing with the acknowledgement or {@link SignalReply#timedOut()}
   */
  CompletableFuture<SignalReply> fireSync(String signal, Map<String, Object> payload, Duration timeout);
}
