package ca.gc.cra.switchboard.application.bus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live instances of one bus, in creation order.
 *
 * <p>Lookups by class return snapshots so handlers may spawn or despawn while a fan-out iterates. Accessed under the
 * {@link DispatchGuard}.</p>
 */
final class InstanceTable {
  private final Map<String, NodeInstance> byId = new LinkedHashMap<>();

  void add(NodeInstance instance) {
    byId.put(instance.id(), instance);
  }

  NodeInstance remove(String id) {
    return byId.remove(id);
  }

  NodeInstance get(String id) {
    return byId.get(id);
  }

  boolean contains(String id) {
    return byId.containsKey(id);
  }

  List<NodeInstance> ofClass(String className) {
    List<NodeInstance> matches = new ArrayList<>();
    for (NodeInstance instance : byId.values()) {
      if (instance.className().equals(className)) {
        matches.add(instance);
      }
    }
    return matches;
  }

  List<NodeInstance> all() {
    return new ArrayList<>(byId.values());
  }

  int size() {
    return byId.size();
  }
}
