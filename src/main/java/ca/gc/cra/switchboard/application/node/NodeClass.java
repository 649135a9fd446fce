package ca.gc.cra.switchboard.application.node;

import ca.gc.cra.switchboard.domain.node.Channel;
import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.domain.node.HandlerNames;
import ca.gc.cra.switchboard.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable node template: name, domain, contract, handlers, defaults and mode overrides.
 * <p><strong>Why:</strong> Inheritance is resolved once when the class is built. Required handlers, defaults,
 * handlers, mode overrides and signal routes are flattened into lookup tables so dispatch never walks the parent
 * chain.</p>
 * <p><strong>Role:</strong> Node model consumed by {@link NodeClassRegistry} and the bus runtime.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}.</p>
 *
 * <p>Every class descends from the root class {@value #ROOT_NAME}, which requires the System hooks {@code onInit},
 * {@code onStart} and {@code onStop} and supplies no-op defaults for them and for {@code onModeChange},
 * {@code onSpawned} and {@code onDespawning}.</p>
 *
 * @since 0.1.0
 */
public final class NodeClass {
  /** Name of the root class every definition extends. */
  public static final String ROOT_NAME = "Node";

  private static final NodeClass ROOT = buildRoot();

  private final String name;
  private final NodeClass parent;
  private final Domain domain;
  private final List<String> ancestry;
  private final List<RequiredHandler> requiredHandlers;
  private final Map<Channel, Map<String, SignalHandler>> handlers;
  private final Map<Channel, Map<String, SignalHandler>> defaults;
  private final Map<String, Map<Channel, Map<String, SignalHandler>>> modeHandlers;
  private final List<String> outputs;
  private final Map<String, String> explicitRoutes;
  private final Map<String, String> signalRoutes;

  private NodeClass(Builder builder) {
    this.name = builder.name;
    this.parent = builder.parent;
    this.domain = builder.domain != null
        ? builder.domain
        : parent != null ? parent.domain : Domain.SHARED;

    List<String> chain = new ArrayList<>(parent == null ? List.of() : parent.ancestry);
    chain.add(name);
    this.ancestry = List.copyOf(chain);

    this.requiredHandlers = mergeRequired(parent, builder);
    this.handlers = overlay(parent == null ? null : parent.handlers, builder.handlers);
    this.defaults = overlay(parent == null ? null : parent.defaults, builder.defaults);
    this.modeHandlers = overlayModes(parent == null ? null : parent.modeHandlers, builder.modeHandlers);
    this.outputs = builder.outputs != null
        ? List.copyOf(builder.outputs)
        : parent != null ? parent.outputs : List.of();

    Map<String, String> routes = new LinkedHashMap<>(parent == null ? Map.of() : parent.explicitRoutes);
    routes.putAll(builder.routes);
    this.explicitRoutes = Collections.unmodifiableMap(routes);
    this.signalRoutes = buildSignalRoutes();
  }

  /**
   * Returns the root class.
   *
   * @return root class {@value #ROOT_NAME}
   */
  public static NodeClass root() {
    return ROOT;
  }

  /**
   * Starts a definition that extends the root class.
   *
   * @param name unique class name
   * @return builder for the new class
   */
  public static Builder define(String name) {
    return new Builder(name, ROOT);
  }

  /**
   * Starts a definition that extends this class.
   *
   * @param childName unique class name
   * @return builder inheriting this class's contract and handlers
   */
  public Builder extend(String childName) {
    return new Builder(childName, this);
  }

  public String name() {
    return name;
  }

  public Domain domain() {
    return domain;
  }

  public boolean isRoot() {
    return parent == null;
  }

  /**
   * Parent class, absent only for the root.
   *
   * @return parent class
   */
  public Optional<NodeClass> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Names from the root down to this class.
   *
   * @return immutable ancestry, ending with {@link #name()}
   */
  public List<String> ancestry() {
    return ancestry;
  }

  /**
   * Effective contract: the union of this class's and all ancestors' requirements.
   *
   * @return immutable list of required handlers
   */
  public List<RequiredHandler> requiredHandlers() {
    return requiredHandlers;
  }

  /**
   * Declared output signals.
   *
   * @return immutable list of signal names
   */
  public List<String> outputs() {
    return outputs;
  }

  /**
   * Modes for which this class carries handler overrides.
   *
   * @return immutable set of mode names
   */
  public Set<String> overriddenModes() {
    return modeHandlers.keySet();
  }

  /**
   * Resolves an unscoped handler: the class handler first, then the inherited default.
   *
   * @param channel pin
   * @param handlerName handler identifier
   * @return handler, or empty when neither exists
   */
  public Optional<SignalHandler> handler(Channel channel, String handlerName) {
    SignalHandler handler = handlers.get(channel).get(handlerName);
    if (handler == null) {
      handler = defaults.get(channel).get(handlerName);
    }
    return Optional.ofNullable(handler);
  }

  /**
   * Resolves a handler override scoped to one mode.
   *
   * @param mode mode name
   * @param channel pin
   * @param handlerName handler identifier
   * @return override, or empty when the class does not override it for {@code mode}
   */
  public Optional<SignalHandler> modeHandler(String mode, Channel channel, String handlerName) {
    Map<Channel, Map<String, SignalHandler>> table = modeHandlers.get(mode);
    if (table == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(table.get(channel).get(handlerName));
  }

  /**
   * Checks whether the class itself or an inherited default implements a handler.
   *
   * @param channel pin
   * @param handlerName handler identifier
   * @return {@code true} when implemented
   */
  public boolean implementsHandler(Channel channel, String handlerName) {
    return handler(channel, handlerName).isPresent();
  }

  /**
   * Maps a signal to the Input handler that receives it using the table built with the class.
   *
   * @param signal signal name
   * @return handler identifier; falls back to the naming rule for signals the class does not know
   */
  public String handlerForSignal(String signal) {
    String route = signalRoutes.get(signal);
    if (route == null) {
      route = signalRoutes.get(HandlerNames.canonicalSignal(signal));
    }
    return route != null ? route : HandlerNames.forSignal(signal);
  }

  /**
   * Static signal to Input handler table.
   *
   * @return immutable routes
   */
  public Map<String, String> signalRoutes() {
    return signalRoutes;
  }

  @Override
  public String toString() {
    return "NodeClass[" + name + ", " + domain + "]";
  }

  private Map<String, String> buildSignalRoutes() {
    Set<String> inputHandlers = new LinkedHashSet<>();
    inputHandlers.addAll(handlers.get(Channel.INPUT).keySet());
    inputHandlers.addAll(defaults.get(Channel.INPUT).keySet());
    for (Map<Channel, Map<String, SignalHandler>> table : modeHandlers.values()) {
      inputHandlers.addAll(table.get(Channel.INPUT).keySet());
    }
    Map<String, String> routes = new LinkedHashMap<>();
    for (String handlerName : inputHandlers) {
      HandlerNames.signalFor(handlerName).ifPresent(signal -> routes.putIfAbsent(signal, handlerName));
    }
    for (Map.Entry<String, String> alias : explicitRoutes.entrySet()) {
      if (!inputHandlers.contains(alias.getValue())) {
        throw new IllegalArgumentException("Route " + alias.getKey() + " -> " + alias.getValue()
            + " on class " + name + " targets an undefined Input handler");
      }
      routes.put(alias.getKey(), alias.getValue());
    }
    return Collections.unmodifiableMap(routes);
  }

  private static List<RequiredHandler> mergeRequired(NodeClass parent, Builder builder) {
    Map<String, RequiredHandler> merged = new LinkedHashMap<>();
    if (parent != null) {
      for (RequiredHandler inherited : parent.requiredHandlers) {
        merged.put(inherited.qualifiedName(), inherited);
      }
    }
    for (Map.Entry<Channel, Set<String>> entry : builder.required.entrySet()) {
      for (String handlerName : entry.getValue()) {
        RequiredHandler own = new RequiredHandler(entry.getKey(), handlerName, builder.name);
        merged.putIfAbsent(own.qualifiedName(), own);
      }
    }
    return List.copyOf(merged.values());
  }

  private static Map<Channel, Map<String, SignalHandler>> overlay(
      Map<Channel, Map<String, SignalHandler>> inherited,
      Map<Channel, Map<String, SignalHandler>> own) {
    Map<Channel, Map<String, SignalHandler>> result = new EnumMap<>(Channel.class);
    for (Channel channel : Channel.values()) {
      Map<String, SignalHandler> table = new LinkedHashMap<>();
      if (inherited != null) {
        table.putAll(inherited.get(channel));
      }
      Map<String, SignalHandler> ownTable = own.get(channel);
      if (ownTable != null) {
        table.putAll(ownTable);
      }
      result.put(channel, Collections.unmodifiableMap(table));
    }
    return Collections.unmodifiableMap(result);
  }

  private static Map<String, Map<Channel, Map<String, SignalHandler>>> overlayModes(
      Map<String, Map<Channel, Map<String, SignalHandler>>> inherited,
      Map<String, Map<Channel, Map<String, SignalHandler>>> own) {
    Set<String> modes = new LinkedHashSet<>();
    if (inherited != null) {
      modes.addAll(inherited.keySet());
    }
    modes.addAll(own.keySet());
    Map<String, Map<Channel, Map<String, SignalHandler>>> result = new LinkedHashMap<>();
    for (String mode : modes) {
      result.put(mode, overlay(inherited == null ? null : inherited.get(mode),
          own.getOrDefault(mode, Map.of())));
    }
    return Collections.unmodifiableMap(result);
  }

  private static NodeClass buildRoot() {
    Builder root = new Builder(ROOT_NAME, null)
        .domain(Domain.SHARED)
        .require(Channel.SYSTEM, "onInit", "onStart", "onStop");
    for (String hook : List.of("onInit", "onStart", "onStop", "onModeChange", "onSpawned", "onDespawning")) {
      root.defaultHandler(Channel.SYSTEM, hook, SignalHandler.NO_OP);
    }
    return root.build();
  }

  /**
   * Fluent builder for a class definition.
   *
   * <p>Not thread-safe; build once and discard.</p>
   */
  public static final class Builder {
    private final String name;
    private final NodeClass parent;
    private Domain domain;
    private final Map<Channel, Set<String>> required = new EnumMap<>(Channel.class);
    private final Map<Channel, Map<String, SignalHandler>> handlers = new EnumMap<>(Channel.class);
    private final Map<Channel, Map<String, SignalHandler>> defaults = new EnumMap<>(Channel.class);
    private final Map<String, Map<Channel, Map<String, SignalHandler>>> modeHandlers = new LinkedHashMap<>();
    private List<String> outputs;
    private final Map<String, String> routes = new LinkedHashMap<>();

    private Builder(String name, NodeClass parent) {
      this.name = Strings.requireNonBlank("name", name);
      this.parent = parent;
    }

    /**
     * Sets the execution domain; inherited from the parent when never called.
     *
     * @param value domain tag
     * @return this builder
     */
    public Builder domain(Domain value) {
      this.domain = Objects.requireNonNull(value, "domain");
      return this;
    }

    /**
     * Adds handlers that this class and every descendant must implement.
     *
     * @param channel pin
     * @param handlerNames handler identifiers
     * @return this builder
     */
    public Builder require(Channel channel, String... handlerNames) {
      Objects.requireNonNull(channel, "channel");
      Set<String> names = required.computeIfAbsent(channel, c -> new LinkedHashSet<>());
      for (String handlerName : handlerNames) {
        names.add(Strings.requireNonBlank("handlerName", handlerName));
      }
      return this;
    }

    /**
     * Implements a handler on this class.
     *
     * @param channel pin
     * @param handlerName handler identifier
     * @param handler implementation
     * @return this builder
     */
    public Builder handler(Channel channel, String handlerName, SignalHandler handler) {
      put(handlers, channel, handlerName, handler);
      return this;
    }

    /**
     * Implements an Input handler.
     *
     * @param handlerName handler identifier such as {@code onFired}
     * @param handler implementation
     * @return this builder
     */
    public Builder onInput(String handlerName, SignalHandler handler) {
      return handler(Channel.INPUT, handlerName, handler);
    }

    /**
     * Implements a System hook.
     *
     * @param handlerName hook identifier such as {@code onStart}
     * @param handler implementation
     * @return this builder
     */
    public Builder onSystem(String handlerName, SignalHandler handler) {
      return handler(Channel.SYSTEM, handlerName, handler);
    }

    /**
     * Supplies a fallback implementation inherited by descendants that do not implement the handler.
     *
     * @param channel pin
     * @param handlerName handler identifier
     * @param handler fallback implementation
     * @return this builder
     */
    public Builder defaultHandler(Channel channel, String handlerName, SignalHandler handler) {
      put(defaults, channel, handlerName, handler);
      return this;
    }

    /**
     * Overrides a handler while {@code mode} (or a mode inheriting from it) is active.
     *
     * @param mode mode name
     * @param channel pin
     * @param handlerName handler identifier
     * @param handler implementation used in that mode
     * @return this builder
     */
    public Builder modeHandler(String mode, Channel channel, String handlerName, SignalHandler handler) {
      String modeName = Strings.requireNonBlank("mode", mode);
      put(modeHandlers.computeIfAbsent(modeName, m -> new EnumMap<>(Channel.class)), channel, handlerName, handler);
      return this;
    }

    /**
     * Declares output signals, replacing any inherited declaration.
     *
     * @param signals output signal names
     * @return this builder
     */
    public Builder outputs(String... signals) {
      List<String> declared = new ArrayList<>();
      for (String signal : signals) {
        declared.add(Strings.requireNonBlank("signal", signal));
      }
      this.outputs = declared;
      return this;
    }

    /**
     * Routes a signal to an Input handler whose name does not follow the naming rule.
     *
     * @param signal signal name
     * @param handlerName Input handler that receives it
     * @return this builder
     */
    public Builder route(String signal, String handlerName) {
      routes.put(Strings.requireNonBlank("signal", signal), Strings.requireNonBlank("handlerName", handlerName));
      return this;
    }

    /**
     * Flattens the definition into an immutable class.
     *
     * @return built class
     * @throws IllegalArgumentException when an explicit route targets an undefined Input handler
     */
    public NodeClass build() {
      return new NodeClass(this);
    }

    private static void put(
        Map<Channel, Map<String, SignalHandler>> target,
        Channel channel,
        String handlerName,
        SignalHandler handler) {
      Objects.requireNonNull(channel, "channel");
      Objects.requireNonNull(handler, "handler");
      target.computeIfAbsent(channel, c -> new LinkedHashMap<>())
          .put(Strings.requireNonBlank("handlerName", handlerName), handler);
    }
  }
}
