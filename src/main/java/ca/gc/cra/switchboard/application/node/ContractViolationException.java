package ca.gc.cra.switchboard.application.node;

import java.util.List;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Boot-fatal failure raised when a class leaves required handlers unimplemented.
 * <p><strong>Why:</strong> Reporting every violation at once lets a developer fix the class in a single pass.</p>
 *
 * @since 0.1.0
 */
public final class ContractViolationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String className;
  private final transient List<RequiredHandler> missing;

  /**
   * Creates the exception.
   *
   * @param className class that failed validation
   * @param missing every required handler without an implementation
   */
  public ContractViolationException(String className, List<RequiredHandler> missing) {
    super(format(className, missing));
    this.className = className;
    this.missing = List.copyOf(missing);
  }

  /**
   * Class that failed validation.
   *
   * @return class name
   */
  public String className() {
    return className;
  }

  /**
   * Every missing handler together with the class that demanded it.
   *
   * @return immutable list of violations
   */
  public List<RequiredHandler> missing() {
    return missing;
  }

  private static String format(String className, List<RequiredHandler> missing) {
    StringJoiner joiner = new StringJoiner(", ");
    for (RequiredHandler handler : missing) {
      joiner.add(handler.qualifiedName() + " (required by " + handler.requiredBy() + ")");
    }
    return "Contract violation in node class " + className + ": missing " + joiner;
  }
}
