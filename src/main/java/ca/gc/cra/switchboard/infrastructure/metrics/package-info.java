/**
 * Metrics adapters that bridge the bus {@link ca.gc.cra.switchboard.application.port.MetricsPort} to OpenTelemetry
 * or to a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code router.*}, {@code lifecycle.*} and {@code errors.*}.</p>
 * <p><strong>Security:</strong> Never exports payload contents; only metric keys are tagged.</p>
 */
package ca.gc.cra.switchboard.infrastructure.metrics;
