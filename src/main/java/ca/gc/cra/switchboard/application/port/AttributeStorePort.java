package ca.gc.cra.switchboard.application.port;

import java.util.Map;
import java.util.Optional;

/**
 * Optional persistent store that node handlers use to save and restore attributes per mode.
 *
 * <p>The router never consults it.</p>
 *
 * @since 0.1.0
 */
public interface AttributeStorePort {
  /**
   * Loads attributes previously saved for an instance under a mode.
   *
   * @param instanceId node instance id
   * @param mode mode name
   * @return saved attributes, or empty when nothing was saved
   */
  Optional<Map<String, Object>> load(String instanceId, String mode);

  /**
   * Saves attributes for an instance under a mode, replacing any previous snapshot.
   *
   * @param instanceId node instance id
   * @param mode mode name
   * @param attributes attributes to save
   */
  void save(String instanceId, String mode, Map<String, Object> attributes);

  /** Store that keeps nothing. */
  AttributeStorePort NO_OP = new AttributeStorePort() {
    @Override
    public Optional<Map<String, Object>> load(String instanceId, String mode) {
      return Optional.empty();
    }

    @Override
    public void save(String instanceId, String mode, Map<String, Object> attributes) {}
  };
}
