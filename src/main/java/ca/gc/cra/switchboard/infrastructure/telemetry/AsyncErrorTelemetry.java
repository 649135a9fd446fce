package ca.gc.cra.switchboard.infrastructure.telemetry;

import ca.gc.cra.switchboard.application.port.ErrorTelemetryPort;
import ca.gc.cra.switchboard.application.port.MetricsPort;
import ca.gc.cra.switchboard.domain.error.ErrorEvent;
import ca.gc.cra.switchboard.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decorator that publishes error events on a single background worker.
 * <p><strong>Why:</strong> Telemetry backends may block; the router hands events off and keeps dispatching.</p>
 * <p><strong>Thread-safety:</strong> {@link #publish(ErrorEvent)} may be called from any thread; events reach the
 * delegate in submission order.</p>
 * <p><strong>Observability:</strong> Counter {@code telemetry.async.dropped} for events submitted after close;
 * delegate failures are logged at warn and counted {@code telemetry.async.failed}.</p>
 *
 * @since 0.1.0
 */
public final class AsyncErrorTelemetry implements ErrorTelemetryPort {
  private static final Logger log = LoggerFactory.getLogger(AsyncErrorTelemetry.class);
  private static final long CLOSE_TIMEOUT_MILLIS = 5_000L;

  private final ErrorTelemetryPort delegate;
  private final MetricsPort metrics;
  private final ExecutorService worker;

  /**
   * Wraps a sink.
   *
   * @param delegate sink receiving events on the worker thread
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public AsyncErrorTelemetry(ErrorTelemetryPort delegate, MetricsPort metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.worker = ExecutorFactories.newSingleWorker("switchboard-telemetry");
  }

  @Override
  public void publish(ErrorEvent event) {
    Objects.requireNonNull(event, "event");
    try {
      worker.execute(() -> deliver(event));
    } catch (RejectedExecutionException ex) {
      metrics.increment("telemetry.async.dropped");
      log.warn("Telemetry worker closed; dropping event for {} ({})", event.instanceId(), event.handler());
    }
  }

  /**
   * Drains queued events, then closes the delegate.
   */
  @Override
  public void close() {
    worker.shutdown();
    try {
      if (!worker.awaitTermination(CLOSE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Telemetry worker did not drain within {} ms", CLOSE_TIMEOUT_MILLIS);
        worker.shutdownNow();
      }
    } catch (InterruptedException ex) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      delegate.close();
    }
  }

  private void deliver(ErrorEvent event) {
    try {
      delegate.publish(event);
    } catch (RuntimeException ex) {
      metrics.increment("telemetry.async.failed");
      log.warn("Telemetry delegate failed for {} ({})", event.instanceId(), event.handler(), ex);
    }
  }
}
