package ca.gc.cra.switchboard.application.node;

/**
 * Raised when a class name is registered twice.
 *
 * @since 0.1.0
 */
public final class DuplicateNodeClassException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param className duplicated class name
   */
  public DuplicateNodeClassException(String className) {
    super("Node class already registered: " + className);
  }
}
