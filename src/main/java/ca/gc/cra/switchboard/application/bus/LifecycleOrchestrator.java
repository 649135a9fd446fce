package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.node.NodeClass;
import ca.gc.cra.switchboard.application.node.NodeClassRegistry;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.LifecycleState;
import ca.gc.cra.switchboard.validation.Strings;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives the bus and its instances through {@code CREATED → INITIALIZED → STARTED →
 * STOPPED}.
 * <p><strong>Why:</strong> Late arrivals (spawned or instantiated on a running bus) must see the same hooks, in the
 * same order, as instances present at startup.</p>
 * <p><strong>Role:</strong> Application service owned by {@link SignalBus}; every call arrives under the dispatch
 * guard.</p>
 * <p><strong>Observability:</strong> Counters {@code lifecycle.spawned}, {@code lifecycle.despawned},
 * {@code lifecycle.skipped}; transitions at info.</p>
 *
 * @since 0.1.0
 */
final class LifecycleOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(LifecycleOrchestrator.class);

  static final String ON_INIT = "onInit";
  static final String ON_START = "onStart";
  static final String ON_STOP = "onStop";
  static final String ON_SPAWNED = "onSpawned";
  static final String ON_DESPAWNING = "onDespawning";

  private final NodeClassRegistry classes;
  private final InstanceTable instances;
  private final MessageRouter router;
  private final MetricsPort metrics;
  private final Domain context;
  private final Map<String, List<String>> groups = new LinkedHashMap<>();
  private final NodeRuntime runtime;
  private LifecycleState phase = LifecycleState.CREATED;

  LifecycleOrchestrator(
      NodeClassRegistry classes,
      InstanceTable instances,
      MessageRouter router,
      MetricsPort metrics,
      Domain context,
      NodeRuntime runtime) {
    this.classes = Objects.requireNonNull(classes, "classes");
    this.instances = Objects.requireNonNull(instances, "instances");
    this.router = Objects.requireNonNull(router, "router");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.context = Objects.requireNonNull(context, "context");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  LifecycleState phase() {
    return phase;
  }

  /**
   * Creates an instance and catches it up to the bus phase without {@code onSpawned}.
   */
  Optional<NodeInstance> instantiate(String className, String id, Map<String, Object> attributes) {
    NodeInstance instance = create(className, id, attributes);
    if (instance == null) {
      return Optional.empty();
    }
    catchUp(instance, false);
    return Optional.of(instance);
  }

  /**
   * Creates an instance at runtime; {@code onSpawned} runs before {@code onInit} when the bus is initialized.
   */
  Optional<NodeInstance> spawn(String className, String id, Map<String, Object> attributes) {
    NodeInstance instance = create(className, id, attributes);
    if (instance == null) {
      return Optional.empty();
    }
    metrics.increment("lifecycle.spawned");
    catchUp(instance, true);
    log.info("Spawned {} ({})", instance.id(), instance.className());
    return Optional.of(instance);
  }

  void init() {
    if (phase == LifecycleState.STOPPED) {
      throw new LifecycleException("Bus is stopped; init() is not allowed");
    }
    if (phase.isAtLeast(LifecycleState.INITIALIZED)) {
      log.warn("init() called twice; ignoring");
      return;
    }
    phase = LifecycleState.INITIALIZED;
    int count = 0;
    for (NodeInstance instance : instances.all()) {
      if (instance.state() == LifecycleState.CREATED) {
        initialize(instance);
        count++;
      }
    }
    log.info("Bus initialized ({} instance(s))", count);
  }

  void start() {
    if (phase == LifecycleState.STOPPED) {
      throw new LifecycleException("Bus is stopped; start() is not allowed");
    }
    if (phase == LifecycleState.CREATED) {
      throw new LifecycleException("start() requires init() first");
    }
    if (phase == LifecycleState.STARTED) {
      log.warn("start() called twice; ignoring");
      return;
    }
    router.setRoutingEnabled(true);
    phase = LifecycleState.STARTED;
    int count = 0;
    for (NodeInstance instance : instances.all()) {
      if (instance.state() == LifecycleState.INITIALIZED) {
        begin(instance);
        count++;
      }
    }
    log.info("Bus started ({} instance(s))", count);
  }

  void stop() {
    if (phase != LifecycleState.STARTED) {
      log.warn("stop() called while bus is {}; ignoring", phase);
      return;
    }
    int count = 0;
    List<NodeInstance> live = liveInstances();
    while (!live.isEmpty()) {
      for (NodeInstance instance : live) {
        if (instance.state() == LifecycleState.STARTED) {
          router.runHook(instance, ON_STOP, Map.of());
        }
        router.release(instance);
        instance.transition(LifecycleState.STOPPED);
        count++;
      }
      // hooks may spawn while stopping
      live = liveInstances();
    }
    router.setRoutingEnabled(false);
    phase = LifecycleState.STOPPED;
    log.info("Bus stopped ({} instance(s))", count);
  }

  /**
   * Final teardown on bus close. A running bus stops normally; otherwise every live instance releases its owned
   * resources and timers without {@code onStop}, since it never started.
   */
  void shutdown() {
    if (phase == LifecycleState.STARTED) {
      stop();
      return;
    }
    int count = 0;
    for (NodeInstance instance : liveInstances()) {
      router.release(instance);
      instance.transition(LifecycleState.STOPPED);
      count++;
    }
    router.setRoutingEnabled(false);
    phase = LifecycleState.STOPPED;
    log.info("Bus shut down before start ({} instance(s) released)", count);
  }

  boolean despawn(String id) {
    NodeInstance instance = instances.get(id);
    if (instance == null) {
      log.warn("Cannot despawn unknown instance {}", id);
      return false;
    }
    if (instance.state() == LifecycleState.STARTED) {
      router.runHook(instance, ON_STOP, Map.of());
    }
    router.runHook(instance, ON_DESPAWNING, Map.of());
    router.release(instance);
    router.removeWiresTouching(id);
    instances.remove(id);
    if (instance.state() != LifecycleState.STOPPED) {
      instance.transition(LifecycleState.STOPPED);
    }
    metrics.increment("lifecycle.despawned");
    log.info("Despawned {} ({})", id, instance.className());
    return true;
  }

  /**
   * Brings up a group: every child is created (and initialized when the bus is), then every wire is installed, then
   * every child is started when the bus is running.
   *
   * @return instances created on this bus, in declaration order
   */
  List<NodeInstance> assemble(NodeGroup group) {
    Objects.requireNonNull(group, "group");
    if (groups.containsKey(group.id())) {
      throw new IllegalArgumentException("Group already assembled: " + group.id());
    }
    requireOpen();
    validate(group);

    List<NodeInstance> created = new ArrayList<>();
    for (NodeGroup.ChildSpec child : group.children()) {
      NodeInstance instance = create(child.className(), child.id(), child.attributes());
      if (instance == null) {
        continue;
      }
      metrics.increment("lifecycle.spawned");
      if (phase.isAtLeast(LifecycleState.INITIALIZED)) {
        router.runHook(instance, ON_SPAWNED, Map.of());
        initialize(instance);
      }
      created.add(instance);
    }
    router.installWires(group.id(), group.wires());
    if (phase == LifecycleState.STARTED) {
      for (NodeInstance instance : created) {
        if (instance.state() == LifecycleState.INITIALIZED) {
          begin(instance);
        }
      }
    }
    List<String> members = new ArrayList<>();
    created.forEach(instance -> members.add(instance.id()));
    groups.put(group.id(), members);
    log.info("Assembled group {} ({} child(ren), {} wire(s))", group.id(), created.size(), group.wires().size());
    return created;
  }

  boolean disassemble(String groupId) {
    List<String> members = groups.remove(groupId);
    if (members == null) {
      log.warn("Cannot disassemble unknown group {}", groupId);
      return false;
    }
    router.removeWires(groupId);
    for (int i = members.size() - 1; i >= 0; i--) {
      if (instances.contains(members.get(i))) {
        despawn(members.get(i));
      }
    }
    log.info("Disassembled group {}", groupId);
    return true;
  }

  Set<String> groupIds() {
    return Set.copyOf(groups.keySet());
  }

  private NodeInstance create(String className, String id, Map<String, Object> attributes) {
    requireOpen();
    NodeClass nodeClass = classes.resolve(className);
    if (!nodeClass.domain().isLocalTo(context)) {
      metrics.increment("lifecycle.skipped");
      log.debug("Skipping {} ({}): class belongs to {} and this bus runs {}",
          id, className, nodeClass.domain(), context);
      return null;
    }
    String instanceId = Strings.requireNonBlank("id", id);
    if (instances.contains(instanceId)) {
      throw new DuplicateInstanceException(instanceId);
    }
    NodeInstance instance = new NodeInstance(instanceId, nodeClass, attributes, runtime);
    instances.add(instance);
    log.debug("Created {} ({})", instanceId, className);
    return instance;
  }

  private void catchUp(NodeInstance instance, boolean spawned) {
    if (!phase.isAtLeast(LifecycleState.INITIALIZED)) {
      return;
    }
    if (spawned) {
      router.runHook(instance, ON_SPAWNED, Map.of());
    }
    initialize(instance);
    if (phase == LifecycleState.STARTED && instance.state() == LifecycleState.INITIALIZED) {
      begin(instance);
    }
  }

  private void initialize(NodeInstance instance) {
    router.runHook(instance, ON_INIT, Map.of());
    if (instance.state() == LifecycleState.CREATED) {
      instance.transition(LifecycleState.INITIALIZED);
    }
  }

  private void begin(NodeInstance instance) {
    instance.transition(LifecycleState.STARTED);
    router.runHook(instance, ON_START, Map.of());
  }

  private void validate(NodeGroup group) {
    Set<String> ids = new HashSet<>();
    for (NodeGroup.ChildSpec child : group.children()) {
      if (instances.contains(child.id())) {
        throw new DuplicateInstanceException(child.id());
      }
      classes.resolve(child.className());
      ids.add(child.id());
    }
    for (GroupWire wire : group.wires()) {
      for (String endpoint : List.of(wire.fromId(), wire.toId())) {
        if (!ids.contains(endpoint) && !instances.contains(endpoint)) {
          throw new IllegalArgumentException(
              "Group " + group.id() + " wires unknown instance " + endpoint);
        }
      }
    }
  }

  private void requireOpen() {
    if (phase == LifecycleState.STOPPED) {
      throw new LifecycleException("Bus is stopped; no new instances are allowed");
    }
  }

  private List<NodeInstance> liveInstances() {
    List<NodeInstance> live = new ArrayList<>();
    for (NodeInstance instance : instances.all()) {
      if (instance.state() != LifecycleState.STOPPED) {
        live.add(instance);
      }
    }
    return live;
  }
}
