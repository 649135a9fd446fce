package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.node.ErrorChannel;
import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.application.node.NodeContext;
import ca.gc.cra.switchboard.application.node.OutputChannel;
import ca.gc.cra.switchboard.application.node.TaskHandle;
import ca.gc.cra.switchboard.application.port.AttributeStorePort;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.LifecycleState;
import ca.gc.cra.switchboard.domain.node.Message;
import ca.gc.cra.switchboard.domain.node.SignalReply;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Live node created from one {@link NodeClass}.
 * <p><strong>Why:</strong> Holds everything private to a node: attributes, lifecycle state, lock state with its
 * inbox, and owned timers and resources. Other nodes only ever reach it through signals.</p>
 * <p><strong>Role:</strong> Runtime object of the bus; implements the handler-facing {@link NodeContext}.</p>
 * <p><strong>Thread-safety:</strong> Attribute access synchronizes on the instance; everything else runs under the
 * bus dispatch guard.</p>
 *
 * @since 0.1.0
 */
public final class NodeInstance implements NodeContext {
  private static final Logger log = LoggerFactory.getLogger(NodeInstance.class);

  private final String id;
  private final NodeClass nodeClass;
  private final NodeRuntime runtime;
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private final Deque<QueuedMessage> inbox = new ArrayDeque<>();
  private final List<AutoCloseable> resources = new ArrayList<>();
  private final OutputChannel out = new Output();
  private final ErrorChannel err = new Errors();
  private volatile LifecycleState state = LifecycleState.CREATED;
  private SignalWait pendingWait;

  NodeInstance(String id, NodeClass nodeClass, Map<String, Object> initialAttributes, NodeRuntime runtime) {
    this.id = Objects.requireNonNull(id, "id");
    this.nodeClass = Objects.requireNonNull(nodeClass, "nodeClass");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    if (initialAttributes != null) {
      initialAttributes.forEach((name, value) -> {
        if (value != null) {
          attributes.put(name, value);
        }
      });
    }
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String className() {
    return nodeClass.name();
  }

  @Override
  public Domain domain() {
    return nodeClass.domain();
  }

  @Override
  public LifecycleState state() {
    return state;
  }

  @Override
  public Optional<String> activeMode() {
    return runtime.activeMode().name();
  }

  /**
   * Class this instance was created from.
   *
   * @return node class
   */
  public NodeClass nodeClass() {
    return nodeClass;
  }

  @Override
  public synchronized Optional<Object> getAttribute(String name) {
    return Optional.ofNullable(attributes.get(name));
  }

  @Override
  public synchronized void setAttribute(String name, Object value) {
    Objects.requireNonNull(name, "name");
    if (value == null) {
      attributes.remove(name);
    } else {
      attributes.put(name, value);
    }
  }

  @Override
  public synchronized Map<String, Object> attributes() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  @Override
  public OutputChannel out() {
    return out;
  }

  @Override
  public ErrorChannel err() {
    return err;
  }

  @Override
  public CompletableFuture<SignalReply> awaitSignal(String signal, Duration timeout) {
    return runtime.router().awaitSignal(this, signal, timeout);
  }

  @Override
  public CompletableFuture<SignalReply> awaitSignal(String signal) {
    return awaitSignal(signal, runtime.lockTimeout());
  }

  @Override
  public boolean isLocked() {
    return runtime.guard().call(() -> pendingWait != null);
  }

  @Override
  public TaskHandle every(Duration period, Runnable task) {
    return schedule(period, task, true);
  }

  @Override
  public TaskHandle after(Duration delay, Runnable task) {
    return schedule(delay, task, false);
  }

  @Override
  public void own(AutoCloseable resource) {
    Objects.requireNonNull(resource, "resource");
    runtime.guard().run(() -> {
      if (state == LifecycleState.STOPPED) {
        log.warn("Node {} is stopped; closing resource immediately", id);
        closeQuietly(resource);
        return;
      }
      resources.add(resource);
    });
  }

  @Override
  public AttributeStorePort store() {
    return runtime.store();
  }

  @Override
  public String toString() {
    return "NodeInstance[" + id + ", " + nodeClass.name() + ", " + state + "]";
  }

  void transition(LifecycleState next) {
    if (next.ordinal() < state.ordinal()) {
      throw new LifecycleException("Node " + id + " cannot move from " + state + " to " + next);
    }
    log.debug("Node {} {} -> {}", id, state, next);
    state = next;
  }

  SignalWait pendingWait() {
    return pendingWait;
  }

  void lock(SignalWait wait) {
    this.pendingWait = wait;
  }

  void unlock() {
    this.pendingWait = null;
  }

  void enqueue(QueuedMessage message) {
    inbox.addLast(message);
  }

  QueuedMessage pollInbox() {
    return inbox.pollFirst();
  }

  boolean hasQueued() {
    return !inbox.isEmpty();
  }

  int inboxSize() {
    return inbox.size();
  }

  List<QueuedMessage> drainInbox() {
    List<QueuedMessage> drained = new ArrayList<>(inbox);
    inbox.clear();
    return drained;
  }

  void forget(AutoCloseable resource) {
    resources.remove(resource);
  }

  /**
   * Closes owned resources in reverse acquisition order; failures are logged and do not stop the sweep.
   */
  void releaseResources() {
    List<AutoCloseable> owned = new ArrayList<>(resources);
    resources.clear();
    Collections.reverse(owned);
    for (AutoCloseable resource : owned) {
      closeQuietly(resource);
    }
    if (!owned.isEmpty()) {
      log.debug("Released {} resource(s) owned by {}", owned.size(), id);
    }
  }

  private void closeQuietly(AutoCloseable resource) {
    try {
      resource.close();
    } catch (Exception ex) {
      log.warn("Failed to release resource owned by {}", id, ex);
    }
  }

  private TaskHandle schedule(Duration interval, Runnable task, boolean repeat) {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(task, "task");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    return runtime.guard().call(() -> {
      ScheduledTask handle = new ScheduledTask();
      if (state == LifecycleState.STOPPED) {
        log.warn("Node {} is stopped; timer not scheduled", id);
        handle.cancel();
        return handle;
      }
      long nanos = interval.toNanos();
      Runnable run = () -> runtime.router().runTask(this, handle, repeat ? "every" : "after", task, !repeat);
      ScheduledFuture<?> future = repeat
          ? runtime.scheduler().scheduleAtFixedRate(run, nanos, nanos, TimeUnit.NANOSECONDS)
          : runtime.scheduler().schedule(run, nanos, TimeUnit.NANOSECONDS);
      handle.bind(future);
      resources.add(handle);
      return handle;
    });
  }

  /**
   * Timer owned by this instance; closing it cancels the schedule.
   */
  final class ScheduledTask implements TaskHandle, AutoCloseable {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile ScheduledFuture<?> future;

    private void bind(ScheduledFuture<?> scheduled) {
      this.future = scheduled;
      if (cancelled.get()) {
        scheduled.cancel(false);
      }
    }

    @Override
    public void cancel() {
      if (cancelled.compareAndSet(false, true)) {
        ScheduledFuture<?> scheduled = future;
        if (scheduled != null) {
          scheduled.cancel(false);
        }
      }
    }

    @Override
    public boolean isCancelled() {
      return cancelled.get();
    }

    @Override
    public void close() {
      cancel();
    }
  }

  private final class Output implements OutputChannel {
    @Override
    public void fire(String signal, Map<String, Object> payload) {
      runtime.router().send(NodeInstance.this, signal, payload);
    }

    @Override
    public void forward(Message message) {
      runtime.router().forward(NodeInstance.this, message);
    }

    @Override
    public void fireTo(String targetId, String signal, Map<String, Object> payload) {
      runtime.router().sendTo(NodeInstance.this, targetId, signal, payload);
    }

    @Override
    public void forwardTo(String targetId, Message message) {
      runtime.router().forwardTo(NodeInstance.this, targetId, message);
    }

    @Override
    public CompletableFuture<SignalReply> fireSync(String signal, Map<String, Object> payload, Duration timeout) {
      return runtime.router().fireSync(NodeInstance.this, signal, payload, timeout);
    }
  }

  private final class Errors implements ErrorChannel {
    @Override
    public void fire(String error, Map<String, Object> details) {
      runtime.router().errors().reportAnomaly(id, className(), "Err.fire", String.valueOf(error), details);
    }

    @Override
    public void fire(Throwable error, Map<String, Object> details) {
      runtime.router().errors().reportFailure(id, className(), "Err.fire", error, details);
    }
  }
}
