package ca.gc.cra.switchboard.application.node;

import java.util.List;

/**
 * Raised when a class name does not resolve in the registry.
 *
 * @since 0.1.0
 */
public final class UnknownNodeClassException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final List<String> classNames;

  /**
   * Creates the exception for one missing class.
   *
   * @param className unresolved class name
   */
  public UnknownNodeClassException(String className) {
    this(List.of(className), "Unknown node class: " + className);
  }

  private UnknownNodeClassException(List<String> classNames, String message) {
    super(message);
    this.classNames = List.copyOf(classNames);
  }

  /**
   * Creates the exception listing every expected class that is not registered.
   *
   * @param classNames unresolved class names
   * @return exception naming all of them
   */
  public static UnknownNodeClassException missing(List<String> classNames) {
    return new UnknownNodeClassException(
        classNames, "Missing node classes: " + String.join(", ", classNames));
  }

  /**
   * Unresolved class names.
   *
   * @return immutable list of names
   */
  public List<String> classNames() {
    return classNames;
  }
}
