package ca.gc.cra.switchboard.application.mode;

import java.util.ArrayList;
import java.util.Collections;
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
 * <strong>What:</strong> Stores mode definitions and resolves them along their {@code base} chains.
 * <p><strong>Why:</strong> Modes inherit wiring and node lists from their base so topologies can be expressed as
 * small deltas.</p>
 * <p><strong>Resolution rule:</strong> a mode's wiring entry for a source class fully replaces the list inherited
 * for that class. Target lists are never concatenated, so an override always states the complete set of targets.</p>
 * <p><strong>Thread-safety:</strong> Methods synchronize on the registry.</p>
 *
 * @since 0.1.0
 */
public final class ModeRegistry {
  private static final Logger log = LoggerFactory.getLogger(ModeRegistry.class);

  private final Map<String, ModeDefinition> modes = new LinkedHashMap<>();

  /**
   * Stores or replaces a mode. Classes are not checked here; they may register later.
   *
   * @param definition mode definition
   * @return the definition it replaced, if any
   */
  public synchronized Optional<ModeDefinition> define(ModeDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    ModeDefinition previous = modes.put(definition.name(), definition);
    if (previous != null) {
      log.debug("Redefined mode {}", definition.name());
    } else {
      log.debug("Defined mode {} (base={})", definition.name(), definition.base());
    }
    return Optional.ofNullable(previous);
  }

  public synchronized boolean isDefined(String name) {
    return modes.containsKey(name);
  }

  /**
   * Returns a stored definition.
   *
   * @param name mode name
   * @return definition, or empty when undefined
   */
  public synchronized Optional<ModeDefinition> definition(String name) {
    return Optional.ofNullable(modes.get(name));
  }

  /**
   * Defined mode names in definition order.
   *
   * @return immutable list
   */
  public synchronized List<String> modeNames() {
    return List.copyOf(modes.keySet());
  }

  /**
   * Lists a mode followed by its bases, nearest first.
   *
   * @param name mode name
   * @return immutable lineage starting with {@code name}
   * @throws UnknownModeException when the mode or one of its bases is undefined
   * @throws ModeConfigurationException when the base chain loops
   */
  public synchronized List<String> lineage(String name) {
    if (!modes.containsKey(name)) {
      throw new UnknownModeException(name);
    }
    List<String> chain = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    String current = name;
    while (current != null) {
      if (!seen.add(current)) {
        List<String> cycle = new ArrayList<>(chain);
        cycle.add(current);
        throw ModeConfigurationException.cycle(cycle);
      }
      ModeDefinition definition = modes.get(current);
      if (definition == null) {
        throw new UnknownModeException(current, chain.get(chain.size() - 1));
      }
      chain.add(current);
      current = definition.base();
    }
    return List.copyOf(chain);
  }

  /**
   * Resolves the wiring of a mode: the base chain first, then each mode's own entries, each key replacing the
   * inherited list outright.
   *
   * @param name mode name
   * @return immutable map of source class to target classes
   * @throws UnknownModeException when the mode or one of its bases is undefined
   * @throws ModeConfigurationException when the base chain loops
   */
  public synchronized Map<String, List<String>> resolveWiring(String name) {
    List<String> chain = lineage(name);
    Map<String, List<String>> resolved = new LinkedHashMap<>();
    for (int i = chain.size() - 1; i >= 0; i--) {
      resolved.putAll(modes.get(chain.get(i)).wiring());
    }
    return Collections.unmodifiableMap(resolved);
  }

  /**
   * Resolves the active classes of a mode as the union of the node lists along its base chain.
   *
   * @param name mode name
   * @return immutable set, base classes first
   */
  public synchronized Set<String> resolveNodes(String name) {
    List<String> chain = lineage(name);
    Set<String> nodes = new LinkedHashSet<>();
    for (int i = chain.size() - 1; i >= 0; i--) {
      nodes.addAll(modes.get(chain.get(i)).nodes());
    }
    return Collections.unmodifiableSet(nodes);
  }
}
