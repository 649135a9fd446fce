package ca.gc.cra.switchboard.application.node;

import ca.gc.cra.switchboard.application.port.AttributeStorePort;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.LifecycleState;
import ca.gc.cra.switchboard.domain.node.SignalReply;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> View of a live node instance handed to its own handlers.
 * <p><strong>Why:</strong> Handlers reach their attributes, pins, timers and waits only through this view; no node
 * holds a reference to another node's state.</p>
 * <p><strong>Thread-safety:</strong> Calls are serialized by the owning bus.</p>
 *
 * @since 0.1.0
 */
public interface NodeContext {
  /**
   * Returns the instance id, unique within its bus.
   *
   * @return instance id
   */
  String id();

  /**
   * Returns the name of the class this instance was created from.
   *
   * @return class name
   */
  String className();

  /**
   * Returns the execution domain of the class.
   *
   * @return domain
   */
  Domain domain();

  /**
   * Returns the lifecycle state.
   *
   * @return current state
   */
  LifecycleState state();

  /**
   * Returns the mode active on the bus.
   *
   * @return active mode, or empty before the first switch
   */
  Optional<String> activeMode();

  /**
   * Reads an attribute.
   *
   * @param name attribute name
   * @return value, or empty when unset
   */
  Optional<Object> getAttribute(String name);

  /**
   * Writes an attribute; a {@code null} value removes it. Triggers no side effects.
   *
   * @param name attribute name
   * @param value new value
   */
  void setAttribute(String name, Object value);

  /**
   * Returns a snapshot of every attribute.
   *
   * @return immutable copy of the attributes
   */
  Map<String, Object> attributes();

  /**
   * Output pin.
   *
   * @return output channel bound to this instance
   */
  OutputChannel out();

  /**
   * Error pin.
   *
   * @return error channel bound to this instance
   */
  ErrorChannel err();

  /**
   * Locks this node until {@code signal} arrives or {@code timeout} elapses. Other inbound messages are queued and
   * replayed in arrival order once the wait resolves.
   *
   * @param signal awaited signal
   * @param timeout maximum wait
   * @return future completing with the reply or {@link SignalReply#timedOut()}
   * @throws IllegalStateException when this node is already waiting
   */
  CompletableFuture<SignalReply> awaitSignal(String signal, Duration timeout);

  /**
   * Locks this node using the bus default lock timeout.
   *
   * @param signal awaited signal
   * @return future completing with the reply or {@link SignalReply#timedOut()}
   */
  CompletableFuture<SignalReply> awaitSignal(String signal);

  /**
   * Indicates whether this node is waiting for a signal.
   *
   * @return {@code true} while locked
   */
  boolean isLocked();

  /**
   * Runs {@code task} repeatedly until cancelled or until this instance stops.
   *
   * @param period interval between runs
   * @param task work to run under the bus dispatch lock
   * @return handle to cancel the timer
   */
  TaskHandle every(Duration period, Runnable task);

  /**
   * Runs {@code task} once after {@code delay} unless this instance stops first.
   *
   * @param delay delay before the run
   * @param task work to run under the bus dispatch lock
   * @return handle to cancel the timer
   */
  TaskHandle after(Duration delay, Runnable task);

  /**
   * Ties a resource to this instance; it is closed when the instance stops or despawns.
   *
   * @param resource resource to close on teardown
   */
  void own(AutoCloseable resource);

  /**
   * Persistent store configured on the bus.
   *
   * @return attribute store, {@link AttributeStorePort#NO_OP} when none is configured
   */
  AttributeStorePort store();
}
