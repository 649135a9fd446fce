package ca.gc.cra.switchboard.application.node;

/**
 * Raised when no mode override, class handler or default implements a handler.
 *
 * <p>Non-fatal: callers decide whether the absence is expected.</p>
 *
 * @since 0.1.0
 */
public final class HandlerNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String className;
  private final String handler;

  /**
   * Creates the exception.
   *
   * @param className class that was searched
   * @param handler qualified handler name
   */
  public HandlerNotFoundException(String className, String handler) {
    super("No handler " + handler + " on class " + className);
    this.className = className;
    this.handler = handler;
  }

  /**
   * Class that was searched.
   *
   * @return class name
   */
  public String className() {
    return className;
  }

  /**
   * Handler that was not found.
   *
   * @return qualified handler name
   */
  public String handler() {
    return handler;
  }
}
