package ca.gc.cra.switchboard.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(null);
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void explicitExporterWinsOverSystemProperty() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "otlp");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("none");
    assertTrue(result.isNoop());
    result.close();
  }

  @Test
  void noopAdapterAcceptsCalls() {
    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("none");
    assertDoesNotThrow(() -> {
      adapter.increment("router.message.delivered");
      adapter.observe("router.dispatch.latencyNanos", 5L);
      adapter.forceFlush();
    });
    adapter.close();
  }
}
