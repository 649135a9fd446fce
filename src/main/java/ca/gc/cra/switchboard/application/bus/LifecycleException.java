package ca.gc.cra.switchboard.application.bus;

/**
 * Raised when a lifecycle operation is called out of order, such as {@code start()} before {@code init()}.
 *
 * @since 0.1.0
 */
public final class LifecycleException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the invalid transition
   */
  public LifecycleException(String message) {
    super(message);
  }
}
