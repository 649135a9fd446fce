package ca.gc.cra.switchboard.application.bus;

/**
 * Raised when an instance id is already in use on the bus.
 *
 * @since 0.1.0
 */
public final class DuplicateInstanceException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param instanceId duplicated id
   */
  public DuplicateInstanceException(String instanceId) {
    super("Node instance id already in use: " + instanceId);
  }
}
