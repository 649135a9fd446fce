package ca.gc.cra.switchboard.config;

import ca.gc.cra.switchboard.application.bus.SignalBus;
import ca.gc.cra.switchboard.application.mode.ModeDefinition;
import ca.gc.cra.switchboard.application.port.BoundaryTransport;
import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.switchboard.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.switchboard.infrastructure.telemetry.AsyncErrorTelemetry;
import ca.gc.cra.switchboard.infrastructure.telemetry.InMemoryErrorTelemetry;
import ca.gc.cra.switchboard.infrastructure.telemetry.LoggingErrorTelemetry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Translates a {@link BusConfig} into a wired {@link SignalBus}.
 * <p><strong>Why:</strong> Keeps adapter selection (metrics exporter, telemetry sink) in one place so the bus only
 * sees ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the metrics adapter and telemetry sink named by the configuration.</li>
 *   <li>Build buses with the configured context and lock timeout.</li>
 *   <li>Define topology modes on a bus and activate the initial mode once classes are registered.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on one thread during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final BusConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root whose metrics adapter follows {@code metricsExporter}.
   *
   * @param config bus configuration
   */
  public CompositionRoot(BusConfig config) {
    this(config, createMetrics(config));
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config bus configuration
   * @param metrics metrics adapter shared by every bus built here
   */
  public CompositionRoot(BusConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public BusConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds a bus that is not connected to any other execution context.
   *
   * @return new bus in {@code CREATED} phase
   */
  public SignalBus buildBus() {
    return buildBus(BoundaryTransport.DISCONNECTED);
  }

  /**
   * Builds a bus using a boundary transport.
   *
   * @param transport endpoint for this bus's context
   * @return new bus in {@code CREATED} phase
   */
  public SignalBus buildBus(BoundaryTransport transport) {
    SignalBus bus = SignalBus.builder()
        .context(config.context())
        .lockTimeout(config.lockTimeout())
        .metrics(metrics)
        .telemetry(telemetry())
        .transport(transport)
        .build();
    log.info("Built {} bus (lockTimeout={} ms, telemetry={}, async={})",
        config.context(), config.lockTimeout().toMillis(), config.telemetry(), config.asyncTelemetry());
    return bus;
  }

  /**
   * Builds the error telemetry sink named by the configuration.
   *
   * @return telemetry sink; the bus that receives it closes it
   */
  public ErrorTelemetryPort telemetry() {
    ErrorTelemetryPort sink = switch (config.telemetry()) {
      case LOG -> new LoggingErrorTelemetry(metrics);
      case MEMORY -> new InMemoryErrorTelemetry();
      case NONE -> ErrorTelemetryPort.NO_OP;
    };
    if (config.asyncTelemetry() && config.telemetry() != BusConfig.TelemetryMode.NONE) {
      return new AsyncErrorTelemetry(sink, metrics);
    }
    return sink;
  }

  /**
   * Defines every topology mode on a bus.
   *
   * @param bus target bus
   * @param topology parsed topology
   */
  public void defineModes(SignalBus bus, Topology topology) {
    for (ModeDefinition mode : topology.modes()) {
      bus.defineMode(mode);
    }
  }

  /**
   * Verifies expected classes and activates the initial mode. Call after every class is registered.
   *
   * @param bus target bus
   * @param topology parsed topology
   * @throws ca.gc.cra.switchboard.application.node.UnknownNodeClassException when expected classes are missing
   */
  public void activate(SignalBus bus, Topology topology) {
    bus.verifyClasses(topology.expectedClasses());
    topology.initialMode().ifPresent(bus::switchMode);
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static MetricsPort createMetrics(BusConfig config) {
    Objects.requireNonNull(config, "config");
    if ("none".equals(config.metricsExporter())) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter());
  }
}
