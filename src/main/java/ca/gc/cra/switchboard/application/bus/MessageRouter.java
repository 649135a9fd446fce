package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.error.ErrorCollector;
import ca.gc.cra.switchboard.application.node.NodeClassRegistry;
import ca.gc.cra.switchboard.application.node.SignalHandler;
import ca.gc.cra.switchboard.application.port.BoundaryTransport;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import ca.gc.cra.switchboard.domain.node.Channel;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.HandlerNames;
import ca.gc.cra.switchboard.domain.node.LifecycleState;
import ca.gc.cra.switchboard.domain.node.Message;
import ca.gc.cra.switchboard.domain.node.SignalReply;
import ca.gc.cra.switchboard.domain.node.SyncToken;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Dispatch core of the bus.
 * <p><strong>Why:</strong> Nodes never reference each other; the router resolves where each signal goes from the
 * active wiring and group wires, and delivers it with cycle protection, lock handling and failure isolation.</p>
 * <p><strong>Role:</strong> Application service owned by one {@link SignalBus}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Mint strictly increasing message ids.</li>
 *   <li>Fan signals out to every instance of every wired target class, handing cross-domain targets to the
 *   boundary transport once per domain.</li>
 *   <li>Drop re-deliveries of a message id to an instance it already reached.</li>
 *   <li>Queue messages for locked instances and replay them in arrival order.</li>
 *   <li>Turn handler exceptions into error events.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every entry point runs under the bus {@link DispatchGuard}; dispatch is
 * synchronous and re-entrant.</p>
 * <p><strong>Observability:</strong> Metrics under {@code router.*}; MDC keys {@code node.id} and
 * {@code node.class} while a handler runs.</p>
 *
 * @since 0.1.0
 */
public final class MessageRouter {
  private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

  private final NodeClassRegistry registry;
  private final InstanceTable instances;
  private final ActiveMode activeMode;
  private final ErrorCollector errors;
  private final MetricsPort metrics;
  private final DispatchGuard guard;
  private final ScheduledExecutorService scheduler;
  private final Domain context;
  private final BoundaryTransport transport;
  private final AtomicLong messageIds = new AtomicLong();
  private final AtomicLong correlationIds = new AtomicLong();
  private final VisitLedger ledger = new VisitLedger();
  private final Map<String, List<GroupWire>> wiresByGroup = new LinkedHashMap<>();
  private volatile boolean routingEnabled;

  MessageRouter(
      NodeClassRegistry registry,
      InstanceTable instances,
      ActiveMode activeMode,
      ErrorCollector errors,
      MetricsPort metrics,
      DispatchGuard guard,
      ScheduledExecutorService scheduler,
      Domain context,
      BoundaryTransport transport) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.instances = Objects.requireNonNull(instances, "instances");
    this.activeMode = Objects.requireNonNull(activeMode, "activeMode");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.guard = Objects.requireNonNull(guard, "guard");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.context = Objects.requireNonNull(context, "context");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /**
   * Mints the next message id. Ids start at 1 and never repeat within a bus, including ids minted by handlers
   * while another message is being delivered.
   *
   * @return strictly increasing id
   */
  public long nextMessageId() {
    return messageIds.incrementAndGet();
  }

  public boolean isRoutingEnabled() {
    return routingEnabled;
  }

  ErrorCollector errors() {
    return errors;
  }

  void setRoutingEnabled(boolean enabled) {
    this.routingEnabled = enabled;
    log.debug("Routing {}", enabled ? "enabled" : "disabled");
  }

  /**
   * Number of message ids whose visited sets are still held, including ids with copies queued behind a lock; zero
   * once all routing and replay has finished.
   *
   * @return in-flight id count
   */
  int inFlightCount() {
    return guard.call(ledger::inFlightCount);
  }

  void send(NodeInstance source, String signal, Map<String, Object> payload) {
    Objects.requireNonNull(signal, "signal");
    guard.run(() -> {
      if (admit(source, signal)) {
        route(source, Message.of(nextMessageId(), signal, payload));
      }
    });
  }

  void forward(NodeInstance source, Message message) {
    Objects.requireNonNull(message, "message");
    guard.run(() -> {
      if (admit(source, message.signal())) {
        route(source, message);
      }
    });
  }

  void sendTo(NodeInstance source, String targetId, String signal, Map<String, Object> payload) {
    Objects.requireNonNull(signal, "signal");
    guard.run(() -> {
      if (source == null ? admitExternal(signal) : admit(source, signal)) {
        direct(targetId, Message.of(nextMessageId(), signal, payload), "route.sendTo");
      }
    });
  }

  void forwardTo(NodeInstance source, String targetId, Message message) {
    Objects.requireNonNull(message, "message");
    guard.run(() -> {
      if (admit(source, message.signal())) {
        direct(targetId, message, "route.forwardTo");
      }
    });
  }

  /**
   * Delivers a System-channel signal to every live instance, bypassing wiring and cycle tracking. Missing hooks are
   * skipped.
   *
   * @param signal lifecycle signal such as {@code modeChange}
   * @param payload payload; may be {@code null}
   */
  void broadcast(String signal, Map<String, Object> payload) {
    Objects.requireNonNull(signal, "signal");
    guard.run(() -> {
      Message message = Message.of(nextMessageId(), signal, payload);
      String hook = HandlerNames.forSignal(signal);
      for (NodeInstance instance : instances.all()) {
        if (instance.state() != LifecycleState.STOPPED) {
          runSystem(instance, hook, message);
        }
      }
    });
  }

  /**
   * Re-enters local dispatch for a signal fired by a class in the other execution context. Only local target
   * classes are reached; nothing is forwarded back across the boundary.
   *
   * @param sourceClass remote sender class
   * @param signal signal name
   * @param payload payload
   */
  void receiveFromBoundary(String sourceClass, String signal, Map<String, Object> payload) {
    Objects.requireNonNull(sourceClass, "sourceClass");
    Objects.requireNonNull(signal, "signal");
    guard.run(() -> {
      metrics.increment("router.boundary.received");
      if (!routingEnabled) {
        metrics.increment("router.message.rejected");
        log.warn("Dropping {} from remote {}: routing is not started", signal, sourceClass);
        return;
      }
      Message message = Message.of(nextMessageId(), signal, payload);
      ledger.open(message.id());
      try {
        for (String targetClass : activeMode.wiring().getOrDefault(sourceClass, List.of())) {
          if (!domainOf(targetClass).isLocalTo(context)) {
            continue;
          }
          for (NodeInstance target : instances.ofClass(targetClass)) {
            deliver(target, message, null);
          }
        }
      } finally {
        ledger.close(message.id());
      }
    });
  }

  CompletableFuture<SignalReply> awaitSignal(NodeInstance instance, String signal, Duration timeout) {
    return guard.call(() -> lock(instance, signal, timeout, message -> true).future());
  }

  CompletableFuture<SignalReply> fireSync(
      NodeInstance source, String signal, Map<String, Object> payload, Duration timeout) {
    Objects.requireNonNull(signal, "signal");
    return guard.call(() -> {
      String correlationId = source.id() + "#" + correlationIds.incrementAndGet();
      SignalWait wait = lock(source, HandlerNames.ACK_SIGNAL, timeout,
          message -> correlationId.equals(message.get("correlationId")));
      if (!admit(source, signal)) {
        resolveWait(source, wait, SignalReply.timedOut());
        return wait.future();
      }
      route(source, new Message(nextMessageId(), signal, payload, new SyncToken(correlationId, source.id())));
      return wait.future();
    });
  }

  void runTask(NodeInstance instance, NodeInstance.ScheduledTask handle, String label, Runnable task, boolean once) {
    guard.run(() -> {
      if (handle.isCancelled() || instance.state() == LifecycleState.STOPPED) {
        return;
      }
      if (once) {
        instance.forget(handle);
        handle.cancel();
      }
      try {
        task.run();
      } catch (RuntimeException ex) {
        metrics.increment("router.handler.failed");
        errors.reportFailure(instance.id(), instance.className(), Channel.SYSTEM.qualify(label), ex, Map.of());
      }
    });
  }

  /**
   * Runs a System hook with failure isolation; a missing hook is skipped.
   *
   * @return {@code false} when the hook threw
   */
  boolean runHook(NodeInstance instance, String hook, Map<String, Object> payload) {
    return guard.call(() -> {
      String signal = HandlerNames.signalFor(hook).orElse(hook);
      return runSystem(instance, hook, Message.of(nextMessageId(), signal, payload));
    });
  }

  /**
   * Tears down an instance's runtime state: a pending wait completes as timed out, its inbox is discarded and owned
   * resources are released.
   */
  void release(NodeInstance instance) {
    guard.run(() -> {
      SignalWait wait = instance.pendingWait();
      if (wait != null) {
        instance.unlock();
        wait.cancelTimeout();
        wait.future().complete(SignalReply.timedOut());
      }
      List<QueuedMessage> discarded = instance.drainInbox();
      for (QueuedMessage queued : discarded) {
        ledger.close(queued.message().id());
      }
      if (!discarded.isEmpty()) {
        log.warn("Discarded {} queued message(s) for {} on teardown", discarded.size(), instance.id());
      }
      instance.releaseResources();
    });
  }

  void installWires(String groupId, List<GroupWire> wires) {
    guard.run(() -> wiresByGroup.put(groupId, List.copyOf(wires)));
  }

  void removeWires(String groupId) {
    guard.run(() -> wiresByGroup.remove(groupId));
  }

  void removeWiresTouching(String instanceId) {
    guard.run(() -> wiresByGroup.replaceAll((group, wires) -> {
      List<GroupWire> kept = new ArrayList<>();
      for (GroupWire wire : wires) {
        if (!wire.fromId().equals(instanceId) && !wire.toId().equals(instanceId)) {
          kept.add(wire);
        }
      }
      return List.copyOf(kept);
    }));
  }

  void sendFromOutside(String sourceId, String signal, Map<String, Object> payload) {
    guard.run(() -> {
      NodeInstance source = instances.get(sourceId);
      if (source == null) {
        metrics.increment("router.message.rejected");
        log.warn("Cannot send {} from unknown instance {}", signal, sourceId);
        errors.reportAnomaly(sourceId, ErrorEvent.UNKNOWN_CLASS, "route.send",
            "No instance with id " + sourceId, payload);
        return;
      }
      send(source, signal, payload);
    });
  }

  private boolean admit(NodeInstance source, String signal) {
    if (!admitExternal(signal)) {
      return false;
    }
    if (source.state() != LifecycleState.INITIALIZED && source.state() != LifecycleState.STARTED) {
      metrics.increment("router.message.rejected");
      log.warn("Dropping {} from {}: node is {}", signal, source.id(), source.state());
      return false;
    }
    return true;
  }

  private boolean admitExternal(String signal) {
    if (!routingEnabled) {
      metrics.increment("router.message.rejected");
      log.warn("Dropping {}: routing is not started", signal);
      return false;
    }
    return true;
  }

  private void route(NodeInstance source, Message message) {
    ledger.open(message.id());
    try {
      ledger.markVisited(message.id(), source.id());
      List<String> targets = activeMode.wiring().getOrDefault(source.className(), List.of());
      if (targets.isEmpty() && activeMode.name().isEmpty()) {
        log.debug("No active mode; {} from {} uses group wires only", message.signal(), source.id());
      }
      Set<Domain> crossed = EnumSet.noneOf(Domain.class);
      for (String targetClass : targets) {
        Domain domain = domainOf(targetClass);
        if (!domain.isLocalTo(context)) {
          if (crossed.add(domain)) {
            handOff(source, message, domain);
          }
          continue;
        }
        for (NodeInstance target : instances.ofClass(targetClass)) {
          deliver(target, message, null);
        }
      }
      for (GroupWire wire : wiresFrom(source.id(), message.signal())) {
        NodeInstance target = instances.get(wire.toId());
        if (target == null) {
          log.debug("Group wire target {} is not present on this bus", wire.toId());
          continue;
        }
        deliver(target, message, wire.handler());
      }
    } finally {
      ledger.close(message.id());
    }
  }

  private void direct(String targetId, Message message, String operation) {
    NodeInstance target = instances.get(targetId);
    if (target == null) {
      metrics.increment("router.message.rejected");
      log.warn("Cannot deliver {} (message {}): no instance {}", message.signal(), message.id(), targetId);
      errors.reportAnomaly(String.valueOf(targetId), ErrorEvent.UNKNOWN_CLASS, operation,
          "No instance with id " + targetId, message.payload());
      return;
    }
    ledger.open(message.id());
    try {
      deliver(target, message, null);
    } finally {
      ledger.close(message.id());
    }
  }

  private void deliver(NodeInstance target, Message message, String handlerOverride) {
    if (target.state() == LifecycleState.STOPPED) {
      log.debug("Skipping stopped instance {} for {}", target.id(), message.signal());
      return;
    }
    if (ledger.hasVisited(message.id(), target.id())) {
      metrics.increment("router.message.cycleDropped");
      log.warn("Dropping {} (message {}) for {}: already delivered under this id",
          message.signal(), message.id(), target.id());
      return;
    }
    SignalWait wait = target.pendingWait();
    if (wait != null && wait.matches(message)) {
      ledger.markVisited(message.id(), target.id());
      resolveWait(target, wait, SignalReply.of(message));
      return;
    }
    if (isAck(message)) {
      log.debug("Discarding unawaited acknowledgement {} for {}", message.payload(), target.id());
      return;
    }
    if (wait != null || target.hasQueued()) {
      // A queued copy holds the id's visited set open until it is replayed or discarded.
      ledger.open(message.id());
      ledger.markVisited(message.id(), target.id());
      target.enqueue(new QueuedMessage(message, handlerOverride));
      metrics.increment("router.message.queued");
      log.debug("Queued {} (message {}) for locked instance {}", message.signal(), message.id(), target.id());
      return;
    }
    dispatch(target, message, handlerOverride, false);
  }

  private void dispatch(NodeInstance target, Message message, String handlerOverride, boolean marked) {
    if (!marked && !ledger.markVisited(message.id(), target.id())) {
      metrics.increment("router.message.cycleDropped");
      log.warn("Dropping {} (message {}) for {}: already delivered under this id",
          message.signal(), message.id(), target.id());
      return;
    }
    String handlerName = handlerOverride != null
        ? handlerOverride
        : target.nodeClass().handlerForSignal(message.signal());
    Optional<SignalHandler> handler =
        PinResolver.find(target.nodeClass(), Channel.INPUT, handlerName, activeMode.lineage());
    if (handler.isEmpty()) {
      metrics.increment("router.handler.missing");
      log.debug("{} has no handler {} for {}", target.id(), Channel.INPUT.qualify(handlerName), message.signal());
      return;
    }
    if (invoke(target, Channel.INPUT, handlerName, handler.get(), message)) {
      metrics.increment("router.message.delivered");
      message.syncToken().ifPresent(token -> acknowledge(target, message, token));
    }
  }

  private void acknowledge(NodeInstance target, Message message, SyncToken token) {
    NodeInstance replyTo = instances.get(token.replyTo());
    if (replyTo == null) {
      log.debug("Acknowledgement target {} is gone", token.replyTo());
      return;
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("correlationId", token.correlationId());
    payload.put("ackFor", message.signal());
    payload.put("targetId", target.id());
    Message ack = Message.of(nextMessageId(), HandlerNames.ACK_SIGNAL, payload);
    ledger.open(ack.id());
    try {
      deliver(replyTo, ack, null);
    } finally {
      ledger.close(ack.id());
    }
  }

  private SignalWait lock(NodeInstance instance, String signal, Duration timeout, Predicate<Message> matcher) {
    Objects.requireNonNull(signal, "signal");
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (instance.pendingWait() != null) {
      throw new IllegalStateException(
          "Node " + instance.id() + " is already waiting for " + instance.pendingWait().signal());
    }
    SignalWait wait = new SignalWait(signal, matcher);
    if (instance.state() == LifecycleState.STOPPED) {
      wait.future().complete(SignalReply.timedOut());
      return wait;
    }
    instance.lock(wait);
    metrics.increment("router.lock.acquired");
    log.debug("{} locked awaiting {} for {} ms", instance.id(), wait.signal(), timeout.toMillis());
    wait.timeout(scheduler.schedule(
        () -> guard.run(() -> resolveWait(instance, wait, SignalReply.timedOut())),
        timeout.toNanos(),
        TimeUnit.NANOSECONDS));
    return wait;
  }

  private void resolveWait(NodeInstance instance, SignalWait wait, SignalReply reply) {
    if (instance.pendingWait() != wait) {
      return;
    }
    instance.unlock();
    wait.cancelTimeout();
    if (reply.isTimedOut()) {
      metrics.increment("router.lock.timedOut");
      log.debug("{} timed out awaiting {}; replaying {} queued message(s)",
          instance.id(), wait.signal(), instance.inboxSize());
    }
    wait.future().complete(reply);
    replay(instance);
  }

  private void replay(NodeInstance instance) {
    while (instance.pendingWait() == null && instance.state() != LifecycleState.STOPPED) {
      QueuedMessage next = instance.pollInbox();
      if (next == null) {
        return;
      }
      metrics.increment("router.message.replayed");
      Message message = next.message();
      try {
        dispatch(instance, message, next.handlerOverride(), true);
      } finally {
        ledger.close(message.id());
      }
    }
  }

  private boolean runSystem(NodeInstance instance, String hook, Message message) {
    Optional<SignalHandler> handler =
        PinResolver.find(instance.nodeClass(), Channel.SYSTEM, hook, activeMode.lineage());
    if (handler.isEmpty()) {
      return true;
    }
    return invoke(instance, Channel.SYSTEM, hook, handler.get(), message);
  }

  private boolean invoke(
      NodeInstance target, Channel channel, String handlerName, SignalHandler handler, Message message) {
    String previousId = MDC.get("node.id");
    String previousClass = MDC.get("node.class");
    long started = System.nanoTime();
    try {
      MDC.put("node.id", target.id());
      MDC.put("node.class", target.className());
      handler.handle(target, message);
      return true;
    } catch (Exception ex) {
      metrics.increment("router.handler.failed");
      errors.reportFailure(target.id(), target.className(), channel.qualify(handlerName), ex, message.payload());
      return false;
    } finally {
      metrics.observe("router.dispatch.latencyNanos", System.nanoTime() - started);
      restoreMdc("node.id", previousId);
      restoreMdc("node.class", previousClass);
    }
  }

  private void handOff(NodeInstance source, Message message, Domain domain) {
    metrics.increment("router.boundary.sent");
    try {
      transport.sendAcrossBoundary(source.className(), message.signal(), message.payload(), domain);
    } catch (RuntimeException ex) {
      errors.reportFailure(source.id(), source.className(), "route.boundary", ex, message.payload());
    }
  }

  private List<GroupWire> wiresFrom(String sourceId, String signal) {
    List<GroupWire> matches = new ArrayList<>();
    for (List<GroupWire> wires : wiresByGroup.values()) {
      for (GroupWire wire : wires) {
        if (wire.fromId().equals(sourceId) && wire.matches(signal)) {
          matches.add(wire);
        }
      }
    }
    return matches;
  }

  private Domain domainOf(String className) {
    return registry.domainOf(className).orElse(Domain.SHARED);
  }

  private static boolean isAck(Message message) {
    return HandlerNames.ACK_SIGNAL.equals(message.signal());
  }

  private static void restoreMdc(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
