package ca.gc.cra.switchboard.application.port;

/**
 * <strong>What:</strong> Port abstracting bus metrics emission.
 * <p><strong>Why:</strong> Lets the router and lifecycle code count deliveries, drops and failures without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from the dispatch thread and scheduler
 * threads concurrently.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code router.message.delivered}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code router.message.cycleDropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
