package ca.gc.cra.switchboard.infrastructure.store;

import ca.gc.cra.switchboard.application.port.AttributeStorePort;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attribute store kept in memory, keyed by instance id and mode. Snapshots are copied on save and on load.
 *
 * @since 0.1.0
 */
public final class InMemoryAttributeStore implements AttributeStorePort {
  private final Map<Key, Map<String, Object>> snapshots = new ConcurrentHashMap<>();

  @Override
  public Optional<Map<String, Object>> load(String instanceId, String mode) {
    Map<String, Object> saved = snapshots.get(new Key(instanceId, mode));
    return saved == null ? Optional.empty() : Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(saved)));
  }

  @Override
  public void save(String instanceId, String mode, Map<String, Object> attributes) {
    Objects.requireNonNull(attributes, "attributes");
    snapshots.put(new Key(instanceId, mode), new LinkedHashMap<>(attributes));
  }

  public int size() {
    return snapshots.size();
  }

  private record Key(String instanceId, String mode) {
    private Key {
      Objects.requireNonNull(instanceId, "instanceId");
      Objects.requireNonNull(mode, "mode");
    }
  }
}
