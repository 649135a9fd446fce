package ca.gc.cra.switchboard.config;

import ca.gc.cra.switchboard.domain.node.Domain;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param section context section the YAML was loaded for
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String section,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML (" + section + ") for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String context = trim(effective.get("context"));
    if (!context.isEmpty()) {
      Domain domain = Domain.parse(context);
      if (domain == Domain.SHARED) {
        throw new IllegalArgumentException("context must be server or client");
      }
    }
    String timeout = trim(effective.get("lockTimeoutMillis"));
    if (!timeout.isEmpty()) {
      try {
        if (Long.parseLong(timeout) <= 0) {
          throw new IllegalArgumentException("lockTimeoutMillis must be positive");
        }
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("lockTimeoutMillis must be a whole number", ex);
      }
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none");
    }
    String telemetry = trim(effective.get("telemetry")).toLowerCase(Locale.ROOT);
    if (!telemetry.isEmpty() && !telemetry.equals("log") && !telemetry.equals("memory")
        && !telemetry.equals("none")) {
      throw new IllegalArgumentException("telemetry must be log, memory or none");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
