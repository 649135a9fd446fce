package ca.gc.cra.switchboard.application.node;

/**
 * Handle to a timer owned by a node instance.
 *
 * @since 0.1.0
 */
public interface TaskHandle {
  /** Cancels the timer; further runs are skipped. Idempotent. */
  void cancel();

  /**
   * Indicates whether the timer was cancelled, explicitly or by instance teardown.
   *
   * @return {@code true} once cancelled
   */
  boolean isCancelled();
}
