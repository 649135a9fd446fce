package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.error.ErrorCollector;
import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import ca.gc.cra.switchboard.application.mode.ModeRegistry;
import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.application.node.NodeClassRegistry;
import ca.gc.cra.switchboard.application.node.SignalHandler;
import ca.gc.cra.switchboard.application.port.AttributeStorePort;
import ca.gc.cra.switchboard.application.port.BoundaryReceiver;
import ca.gc.cra.switchboard.application.port.BoundaryTransport;
import ca.gc.cra.switchboard.application.port.ClockPort;
import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.node.Channel;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.LifecycleState;
import ca.gc.cra.switchboard.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One independent bus: class registry, mode table, instance table, router and lifecycle,
 * behind a single facade.
 * <p><strong>Why:</strong> Keeps all mutable registries inside an explicitly constructed object so a process (or a
 * test) can run several buses side by side and tear each one down with {@link #close()}.</p>
 * <p><strong>Role:</strong> Entry point for bootstrapping code; node handlers reach the bus through their
 * {@link ca.gc.cra.switchboard.application.node.NodeContext} or a captured reference.</p>
 * <p><strong>Thread-safety:</strong> Every operation runs under one reentrant dispatch guard, so the bus behaves as a
 * single logical thread of control. Handlers may call back into the bus.</p>
 * <p><strong>Observability:</strong> See {@link MessageRouter} and {@link LifecycleOrchestrator} for metric names.</p>
 *
 * @since 0.1.0
 */
public final class SignalBus implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SignalBus.class);

  /** Default bound on how long a locked node waits for its reply. */
  public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

  private final Domain context;
  private final DispatchGuard guard = new DispatchGuard();
  private final NodeClassRegistry classes = new NodeClassRegistry();
  private final ModeRegistry modes = new ModeRegistry();
  private final InstanceTable instances = new InstanceTable();
  private final ActiveMode activeMode = new ActiveMode();
  private final ErrorCollector errors;
  private final MessageRouter router;
  private final ModeSwitcher modeSwitcher;
  private final LifecycleOrchestrator lifecycle;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final ErrorTelemetryPort telemetry;

  private SignalBus(Builder builder) {
    this.context = builder.context;
    this.telemetry = builder.telemetry;
    this.ownsScheduler = builder.scheduler == null;
    this.scheduler = ownsScheduler ? ExecutorFactories.newScheduler("switchboard-timer") : builder.scheduler;
    this.errors = new ErrorCollector(builder.telemetry, builder.metrics, builder.clock);
    this.router = new MessageRouter(
        classes, instances, activeMode, errors, builder.metrics, guard, scheduler, context, builder.transport);
    this.modeSwitcher = new ModeSwitcher(modes, classes, instances, activeMode, router);
    NodeRuntime runtime =
        new NodeRuntime(router, guard, scheduler, builder.store, builder.lockTimeout, activeMode);
    this.lifecycle = new LifecycleOrchestrator(classes, instances, router, builder.metrics, context, runtime);
    builder.transport.connect(boundaryReceiver());
    log.debug("Bus created (context={}, lockTimeout={})", context, builder.lockTimeout);
  }

  /**
   * Starts a bus definition.
   *
   * @return builder with defaults: server context, no-op metrics and telemetry, disconnected boundary
   */
  public static Builder builder() {
    return new Builder();
  }

  // Classes

  public void register(NodeClass nodeClass) {
    guard.run(() -> classes.register(nodeClass));
  }

  public NodeClassRegistry registry() {
    return classes;
  }

  public NodeClass resolveClass(String className) {
    return classes.resolve(className);
  }

  /**
   * Fails fast when any expected class is missing.
   *
   * @param expected class names the topology relies on
   */
  public void verifyClasses(Collection<String> expected) {
    classes.verify(expected);
  }

  // Modes

  /**
   * Stores or replaces a mode. Redefining a mode on the active lineage takes effect for the next signal routed.
   *
   * @param definition mode definition
   */
  public void defineMode(ModeDefinition definition) {
    guard.run(() -> modeSwitcher.define(definition));
  }

  public ModeRegistry modes() {
    return modes;
  }

  public Map<String, List<String>> resolveWiring(String mode) {
    return modes.resolveWiring(mode);
  }

  /**
   * Activates a mode: broadcasts {@code modeChange}, applies the mode's attribute overrides, then switches wiring.
   *
   * @param mode mode name
   */
  public void switchMode(String mode) {
    guard.run(() -> modeSwitcher.switchTo(mode));
  }

  public Optional<String> activeMode() {
    return activeMode.name();
  }

  // Instances

  /**
   * Creates an instance and catches it up to the bus phase. Classes of the other execution context yield empty.
   *
   * @param className registered class
   * @param id unique instance id
   * @param attributes initial attributes; may be {@code null}
   * @return the instance, or empty when the class is not local to this bus
   */
  public Optional<NodeInstance> instantiate(String className, String id, Map<String, Object> attributes) {
    return guard.call(() -> lifecycle.instantiate(className, id, attributes));
  }

  public Optional<NodeInstance> instance(String id) {
    return guard.call(() -> Optional.ofNullable(instances.get(id)));
  }

  public List<NodeInstance> instancesOf(String className) {
    return guard.call(() -> instances.ofClass(className));
  }

  public int instanceCount() {
    return guard.call(instances::size);
  }

  // Lifecycle

  public void init() {
    guard.run(lifecycle::init);
  }

  public void start() {
    guard.run(lifecycle::start);
  }

  public void stop() {
    guard.run(lifecycle::stop);
  }

  public LifecycleState state() {
    return guard.call(lifecycle::phase);
  }

  public Optional<NodeInstance> spawn(String className, String id, Map<String, Object> attributes) {
    return guard.call(() -> lifecycle.spawn(className, id, attributes));
  }

  public boolean despawn(String id) {
    return guard.call(() -> lifecycle.despawn(id));
  }

  /**
   * Assembles a group with every wire installed before any child starts.
   *
   * @param group group definition
   * @return created instances in declaration order
   */
  public List<NodeInstance> assemble(NodeGroup group) {
    return guard.call(() -> lifecycle.assemble(group));
  }

  public boolean disassemble(String groupId) {
    return guard.call(() -> lifecycle.disassemble(groupId));
  }

  // Messaging

  public long nextMessageId() {
    return router.nextMessageId();
  }

  /**
   * Fires a signal on behalf of an instance, through the active wiring and its group wires.
   *
   * @param sourceId sending instance
   * @param signal signal name
   * @param payload payload; may be {@code null}
   */
  public void send(String sourceId, String signal, Map<String, Object> payload) {
    router.sendFromOutside(sourceId, signal, payload);
  }

  /**
   * Delivers a signal to one instance, bypassing wiring.
   *
   * @param targetId receiving instance
   * @param signal signal name
   * @param payload payload; may be {@code null}
   */
  public void sendTo(String targetId, String signal, Map<String, Object> payload) {
    router.sendTo(null, targetId, signal, payload);
  }

  public void broadcast(String signal, Map<String, Object> payload) {
    router.broadcast(signal, payload);
  }

  /**
   * Resolves the implementation an instance would run for a handler under the active mode.
   *
   * @param instanceId instance id
   * @param channel pin
   * @param handlerName handler identifier
   * @return handler
   * @throws IllegalArgumentException when the instance does not exist
   * @throws ca.gc.cra.switchboard.application.node.HandlerNotFoundException when nothing implements the handler
   */
  public SignalHandler resolveHandler(String instanceId, Channel channel, String handlerName) {
    return guard.call(() -> {
      NodeInstance instance = instances.get(instanceId);
      if (instance == null) {
        throw new IllegalArgumentException("No instance with id " + instanceId);
      }
      return PinResolver.resolve(instance.nodeClass(), channel, handlerName, activeMode.lineage());
    });
  }

  public ErrorCollector errors() {
    return errors;
  }

  public Domain context() {
    return context;
  }

  public boolean isRoutingEnabled() {
    return router.isRoutingEnabled();
  }

  /**
   * Entry point a boundary transport delivers inbound signals to.
   *
   * @return receiver bound to this bus
   */
  public BoundaryReceiver boundaryReceiver() {
    return router::receiveFromBoundary;
  }

  /**
   * Stops the bus when running, otherwise releases every live instance's resources; then closes telemetry and shuts
   * down the timer it created. The bus cannot be restarted afterwards.
   */
  @Override
  public void close() {
    guard.run(() -> {
      if (lifecycle.phase() != LifecycleState.STOPPED) {
        lifecycle.shutdown();
      }
    });
    try {
      telemetry.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close error telemetry", ex);
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
    log.debug("Bus closed");
  }

  /** Builder for {@link SignalBus}. */
  public static final class Builder {
    private Domain context = Domain.SERVER;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private ErrorTelemetryPort telemetry = ErrorTelemetryPort.NO_OP;
    private ClockPort clock = ClockPort.SYSTEM;
    private BoundaryTransport transport = BoundaryTransport.DISCONNECTED;
    private AttributeStorePort store = AttributeStorePort.NO_OP;
    private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
    private ScheduledExecutorService scheduler;

    private Builder() {}

    /**
     * Execution context of this bus; must be {@link Domain#SERVER} or {@link Domain#CLIENT}.
     */
    public Builder context(Domain context) {
      Objects.requireNonNull(context, "context");
      if (context == Domain.SHARED) {
        throw new IllegalArgumentException("A bus runs in SERVER or CLIENT context, not SHARED");
      }
      this.context = context;
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder telemetry(ErrorTelemetryPort telemetry) {
      this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
      return this;
    }

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder transport(BoundaryTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    public Builder store(AttributeStorePort store) {
      this.store = Objects.requireNonNull(store, "store");
      return this;
    }

    public Builder lockTimeout(Duration lockTimeout) {
      Objects.requireNonNull(lockTimeout, "lockTimeout");
      if (lockTimeout.isNegative() || lockTimeout.isZero()) {
        throw new IllegalArgumentException("lockTimeout must be positive");
      }
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * Scheduler for lock timeouts and node timers. The caller keeps ownership; when unset the bus creates and owns a
     * daemon scheduler.
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
      return this;
    }

    public SignalBus build() {
      return new SignalBus(this);
    }
  }
}
