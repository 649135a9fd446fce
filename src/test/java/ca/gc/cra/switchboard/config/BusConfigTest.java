package ca.gc.cra.switchboard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.switchboard.domain.node.Domain;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BusConfigTest {
  @Test
  void emptyInputYieldsDefaults() {
    BusConfig config = BusConfig.fromMap(Map.of());

    assertEquals(BusConfig.defaults(), config);
    assertEquals(Domain.SERVER, config.context());
    assertEquals(Duration.ofSeconds(5), config.lockTimeout());
    assertEquals("none", config.metricsExporter());
    assertEquals(BusConfig.TelemetryMode.LOG, config.telemetry());
    assertTrue(config.asyncTelemetry());
    assertFalse(config.topology().isPresent());
  }

  @Test
  void parsesEveryKey() {
    BusConfig config = BusConfig.fromMap(Map.of(
        "context", "Client",
        "lockTimeoutMillis", "250",
        "metricsExporter", "OTLP",
        "telemetry", "memory",
        "asyncTelemetry", "no",
        "verbose", "true",
        "topology", "conf/topology.yaml"));

    assertEquals(Domain.CLIENT, config.context());
    assertEquals(Duration.ofMillis(250), config.lockTimeout());
    assertEquals("otlp", config.metricsExporter());
    assertEquals(BusConfig.TelemetryMode.MEMORY, config.telemetry());
    assertFalse(config.asyncTelemetry());
    assertTrue(config.verbose());
    assertEquals(Path.of("conf/topology.yaml"), config.topology().orElseThrow());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(Map.of("context", "shared")));
    assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(Map.of("lockTimeoutMillis", "0")));
    assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(Map.of("lockTimeoutMillis", "soon")));
    assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(Map.of("metricsExporter", "zipkin")));
    assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(Map.of("telemetry", "kafka")));
    assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(Map.of("verbose", "maybe")));
  }

  @Test
  void defaultsMapMatchesDefaultConfig() {
    Map<String, String> flat = BusDefaults.asFlatMap();

    assertEquals("server", flat.get("context"));
    assertEquals("5000", flat.get("lockTimeoutMillis"));
    assertEquals(BusConfig.defaults(), BusConfig.fromMap(flat));
  }
}
