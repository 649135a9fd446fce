package ca.gc.cra.switchboard.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Supplies the flattened default configuration for a bus.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class BusDefaults {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private BusDefaults() {}

  /**
   * Returns the defaults as a flat key/value map.
   *
   * @return unmodifiable map of default values
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    BusConfig defaults = BusConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("context", defaults.context().name().toLowerCase(Locale.ROOT));
    map.put("lockTimeoutMillis", Long.toString(defaults.lockTimeout().toMillis()));
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("telemetry", defaults.telemetry().name().toLowerCase(Locale.ROOT));
    map.put("asyncTelemetry", Boolean.toString(defaults.asyncTelemetry()));
    map.put("verbose", Boolean.toString(defaults.verbose()));
    map.put("topology", "");
    return Map.copyOf(map);
  }
}
