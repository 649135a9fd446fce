package ca.gc.cra.switchboard.config;

import ca.gc.cra.switchboard.domain.node.Domain;
import ca.gc.cra.switchboard.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed settings for building one bus.
 * <p><strong>Why:</strong> Keeps CLI and YAML parsing out of the bus itself; the bus only sees validated values.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param context execution context of the bus ({@link Domain#SERVER} or {@link Domain#CLIENT})
 * @param lockTimeout default wait bound for {@code awaitSignal}
 * @param metricsExporter {@code otlp} or {@code none}
 * @param telemetry error telemetry sink
 * @param asyncTelemetry whether telemetry runs on a background worker
 * @param verbose whether DEBUG logging is enabled
 * @param topology optional topology YAML path
 * @since 0.1.0
 */
public record BusConfig(
    Domain context,
    Duration lockTimeout,
    String metricsExporter,
    TelemetryMode telemetry,
    boolean asyncTelemetry,
    boolean verbose,
    Optional<Path> topology) {

  private static final long MAX_LOCK_TIMEOUT_MILLIS = 3_600_000L;

  public BusConfig {
    Objects.requireNonNull(context, "context");
    if (context == Domain.SHARED) {
      throw new IllegalArgumentException("context must be server or client");
    }
    Objects.requireNonNull(lockTimeout, "lockTimeout");
    Objects.requireNonNull(metricsExporter, "metricsExporter");
    Objects.requireNonNull(telemetry, "telemetry");
    topology = Objects.requireNonNullElse(topology, Optional.empty());
  }

  /**
   * Returns defaults: server context, 5 s lock timeout, no metrics exporter, asynchronous log telemetry.
   *
   * @return default configuration
   */
  public static BusConfig defaults() {
    return new BusConfig(
        Domain.SERVER, Duration.ofSeconds(5), "none", TelemetryMode.LOG, true, false, Optional.empty());
  }

  /**
   * Builds a configuration from a flat map such as {@link ConfigMerger#buildEffectiveConfig} produces.
   *
   * @param input flat key/value settings; missing keys use defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static BusConfig fromMap(Map<String, String> input) {
    Objects.requireNonNull(input, "input");
    BusConfig defaults = defaults();
    Domain context = parseContext(input.get("context"), defaults.context());
    long lockMillis = Numbers.requireRange(
        "lockTimeoutMillis",
        parseLong(input.get("lockTimeoutMillis"), defaults.lockTimeout().toMillis()),
        1,
        MAX_LOCK_TIMEOUT_MILLIS);
    String exporter = parseExporter(input.get("metricsExporter"), defaults.metricsExporter());
    TelemetryMode telemetry = TelemetryMode.parse(input.get("telemetry"), defaults.telemetry());
    boolean async = parseBoolean(input.get("asyncTelemetry"), defaults.asyncTelemetry());
    boolean verbose = parseBoolean(input.get("verbose"), defaults.verbose());
    Optional<Path> topology = parsePath(input.get("topology"));
    return new BusConfig(context, Duration.ofMillis(lockMillis), exporter, telemetry, async, verbose, topology);
  }

  private static Domain parseContext(String raw, Domain fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    Domain domain = Domain.parse(raw);
    if (domain == Domain.SHARED) {
      throw new IllegalArgumentException("context must be server or client (was " + raw + ")");
    }
    return domain;
  }

  private static String parseExporter(String raw, String fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "otlp", "none" -> normalized;
      default -> throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
    };
  }

  private static long parseLong(String raw, long fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Expected a whole number but was " + raw, ex);
    }
  }

  private static boolean parseBoolean(String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("Expected true or false but was " + raw);
    };
  }

  private static Optional<Path> parsePath(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(raw.trim()));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("Invalid topology path: " + raw, ex);
    }
  }

  /** Error telemetry sink selected by {@code telemetry=}. */
  public enum TelemetryMode {
    LOG,
    MEMORY,
    NONE;

    static TelemetryMode parse(String raw, TelemetryMode fallback) {
      if (raw == null || raw.isBlank()) {
        return fallback;
      }
      try {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("telemetry must be log, memory or none (was " + raw + ")", ex);
      }
    }
  }
}
