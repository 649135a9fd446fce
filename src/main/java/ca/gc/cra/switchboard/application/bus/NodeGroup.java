package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Composite of child instances plus the instance-level wires between them.
 * <p><strong>Why:</strong> Lets a parent bring up a whole sub-assembly so that every wire exists before any child
 * starts and fires its handshake.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id group id, unique per bus
 * @param children children in instantiation order
 * @param wires instance-level wires; endpoints must be children of this group or existing instances
 * @since 0.1.0
 */
public record NodeGroup(String id, List<ChildSpec> children, List<GroupWire> wires) {

  public NodeGroup {
    id = Strings.requireNonBlank("id", id);
    children = List.copyOf(Objects.requireNonNull(children, "children"));
    wires = List.copyOf(Objects.requireNonNull(wires, "wires"));
    Set<String> ids = new HashSet<>();
    for (ChildSpec child : children) {
      if (!ids.add(child.id())) {
        throw new IllegalArgumentException("Group " + id + " declares child " + child.id() + " twice");
      }
    }
  }

  /**
   * Starts a fluent group definition.
   *
   * @param id group id
   * @return builder
   */
  public static Builder named(String id) {
    return new Builder(id);
  }

  /**
   * One child of a group.
   *
   * @param id instance id
   * @param className node class
   * @param attributes initial attributes
   */
  public record ChildSpec(String id, String className, Map<String, Object> attributes) {
    public ChildSpec {
      id = Strings.requireNonBlank("id", id);
      className = Strings.requireNonBlank("className", className);
      attributes = attributes == null
          ? Map.of()
          : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
  }

  /** Builder for {@link NodeGroup}. */
  public static final class Builder {
    private final String id;
    private final List<ChildSpec> children = new ArrayList<>();
    private final List<GroupWire> wires = new ArrayList<>();

    private Builder(String id) {
      this.id = id;
    }

    public Builder child(String childId, String className) {
      return child(childId, className, Map.of());
    }

    public Builder child(String childId, String className, Map<String, Object> attributes) {
      children.add(new ChildSpec(childId, className, attributes));
      return this;
    }

    public Builder wire(String fromId, String signal, String toId) {
      return wire(fromId, signal, toId, null);
    }

    public Builder wire(String fromId, String signal, String toId, String handler) {
      wires.add(new GroupWire(fromId, signal, toId, handler));
      return this;
    }

    public NodeGroup build() {
      return new NodeGroup(id, children, wires);
    }
  }
}
