package ca.gc.cra.switchboard.application.bus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Active-mode pointer shared by the router and the mode switcher: name, resolved wiring and lineage are committed
 * together.
 */
final class ActiveMode {
  private volatile Snapshot snapshot = new Snapshot(null, Map.of(), List.of());

  Optional<String> name() {
    return Optional.ofNullable(snapshot.name());
  }

  Map<String, List<String>> wiring() {
    return snapshot.wiring();
  }

  List<String> lineage() {
    return snapshot.lineage();
  }

  void commit(String name, Map<String, List<String>> wiring, List<String> lineage) {
    snapshot = new Snapshot(name, Map.copyOf(wiring), List.copyOf(lineage));
  }

  private record Snapshot(String name, Map<String, List<String>> wiring, List<String> lineage) {}
}
