package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import ca.gc.cra.switchboard.application.mode.ModeRegistry;
import ca.gc.cra.switchboard.application.node.NodeClassRegistry;
import ca.gc.cra.switchboard.domain.node.HandlerNames;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Activates modes: announces the change, applies the mode's attribute overrides and commits the resolved wiring.
 *
 * <p>Runs under the bus dispatch guard.</p>
 */
final class ModeSwitcher {
  private static final Logger log = LoggerFactory.getLogger(ModeSwitcher.class);

  private final ModeRegistry modes;
  private final NodeClassRegistry classes;
  private final InstanceTable instances;
  private final ActiveMode activeMode;
  private final MessageRouter router;

  ModeSwitcher(
      ModeRegistry modes,
      NodeClassRegistry classes,
      InstanceTable instances,
      ActiveMode activeMode,
      MessageRouter router) {
    this.modes = Objects.requireNonNull(modes, "modes");
    this.classes = Objects.requireNonNull(classes, "classes");
    this.instances = Objects.requireNonNull(instances, "instances");
    this.activeMode = Objects.requireNonNull(activeMode, "activeMode");
    this.router = Objects.requireNonNull(router, "router");
  }

  /**
   * Switches to a mode. Resolution failures propagate before anything changes.
   *
   * @param name mode to activate
   */
  void switchTo(String name) {
    List<String> lineage = modes.lineage(name);
    Map<String, List<String>> wiring = modes.resolveWiring(name);
    ModeDefinition definition = modes.definition(name).orElseThrow();
    String previous = activeMode.name().orElse(null);

    warnUnregistered(name, wiring, modes.resolveNodes(name));

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("oldMode", previous);
    payload.put("newMode", name);
    router.broadcast(HandlerNames.MODE_CHANGE_SIGNAL, payload);

    int overlaid = 0;
    for (Map.Entry<String, Map<String, Object>> entry : definition.attributes().entrySet()) {
      for (NodeInstance instance : instances.ofClass(entry.getKey())) {
        entry.getValue().forEach(instance::setAttribute);
        overlaid++;
      }
    }

    activeMode.commit(name, wiring, lineage);
    log.info("Mode {} -> {} (lineage={}, {} instance(s) overlaid)", previous, name, lineage, overlaid);
  }

  /**
   * Stores a mode definition. When the mode is on the active lineage, the active wiring is re-resolved at once;
   * attributes are not re-applied and no {@code modeChange} is broadcast. A redefinition that breaks the active
   * lineage is rolled back and its failure rethrown.
   *
   * @param definition new or replacement definition
   */
  void define(ModeDefinition definition) {
    Optional<ModeDefinition> replaced = modes.define(definition);
    Optional<String> active = activeMode.name();
    if (active.isEmpty() || !activeMode.lineage().contains(definition.name())) {
      return;
    }
    String name = active.get();
    List<String> lineage;
    Map<String, List<String>> wiring;
    try {
      lineage = modes.lineage(name);
      wiring = modes.resolveWiring(name);
    } catch (RuntimeException ex) {
      replaced.ifPresent(modes::define);
      throw ex;
    }
    warnUnregistered(name, wiring, modes.resolveNodes(name));
    activeMode.commit(name, wiring, lineage);
    log.info("Active mode {} re-resolved after {} was redefined", name, definition.name());
  }

  private void warnUnregistered(String mode, Map<String, List<String>> wiring, Set<String> nodes) {
    Set<String> referenced = new LinkedHashSet<>(nodes);
    wiring.forEach((source, targets) -> {
      referenced.add(source);
      referenced.addAll(targets);
    });
    for (String className : referenced) {
      if (!classes.isRegistered(className)) {
        log.warn("Mode {} references unregistered class {}", mode, className);
      }
    }
  }
}
