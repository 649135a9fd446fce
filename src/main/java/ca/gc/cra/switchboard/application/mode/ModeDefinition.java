package ca.gc.cra.switchboard.application.mode;

import ca.gc.cra.switchboard.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Named wiring configuration: optional base, active classes, class wiring and attribute
 * overrides.
 * <p><strong>Thread-safety:</strong> Immutable; collections are defensive copies.</p>
 *
 * @param name mode name
 * @param base parent mode, or {@code null}
 * @param nodes class names active in this mode
 * @param wiring source class to ordered target classes
 * @param attributes class to attribute overrides applied when the mode activates
 * @since 0.1.0
 */
public record ModeDefinition(
    String name,
    String base,
    Set<String> nodes,
    Map<String, List<String>> wiring,
    Map<String, Map<String, Object>> attributes) {

  /**
   * Validates the name and copies every collection.
   */
  public ModeDefinition {
    name = Strings.requireNonBlank("name", name);
    base = base == null || base.isBlank() ? null : base.trim();
    nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes == null ? Set.of() : nodes));
    Map<String, List<String>> wiringCopy = new LinkedHashMap<>();
    if (wiring != null) {
      wiring.forEach((source, targets) -> wiringCopy.put(source, List.copyOf(targets)));
    }
    wiring = Collections.unmodifiableMap(wiringCopy);
    Map<String, Map<String, Object>> attributeCopy = new LinkedHashMap<>();
    if (attributes != null) {
      attributes.forEach((className, values) ->
          attributeCopy.put(className, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
    }
    attributes = Collections.unmodifiableMap(attributeCopy);
  }

  /**
   * Parent mode.
   *
   * @return base mode name when present
   */
  public Optional<String> baseMode() {
    return Optional.ofNullable(base);
  }

  /**
   * Starts a fluent definition.
   *
   * @param name mode name
   * @return builder
   */
  public static Builder named(String name) {
    return new Builder(name);
  }

  /** Fluent builder for tests and programmatic topologies. */
  public static final class Builder {
    private final String name;
    private String base;
    private final Set<String> nodes = new LinkedHashSet<>();
    private final Map<String, List<String>> wiring = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> attributes = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder base(String value) {
      this.base = value;
      return this;
    }

    public Builder nodes(String... classNames) {
      nodes.addAll(List.of(classNames));
      return this;
    }

    /**
     * Sets the full target list for a source class.
     *
     * @param source source class
     * @param targets target classes in delivery order
     * @return this builder
     */
    public Builder wire(String source, String... targets) {
      wiring.put(Objects.requireNonNull(source, "source"), new ArrayList<>(List.of(targets)));
      return this;
    }

    /**
     * Adds one attribute override for a class.
     *
     * @param className class whose instances receive the value
     * @param attribute attribute name
     * @param value attribute value
     * @return this builder
     */
    public Builder attribute(String className, String attribute, Object value) {
      attributes.computeIfAbsent(className, c -> new LinkedHashMap<>()).put(attribute, value);
      return this;
    }

    public ModeDefinition build() {
      return new ModeDefinition(name, base, nodes, wiring, attributes);
    }
  }
}
