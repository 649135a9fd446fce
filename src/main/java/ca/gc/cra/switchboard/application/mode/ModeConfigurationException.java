package ca.gc.cra.switchboard.application.mode;

import java.util.List;

/**
 * Fatal configuration error in mode definitions, such as a cycle in {@code base} chains.
 *
 * @since 0.1.0
 */
public final class ModeConfigurationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception for a base cycle.
   *
   * @param cycle modes visited, ending with the repeated mode
   * @return exception describing the cycle
   */
  public static ModeConfigurationException cycle(List<String> cycle) {
    return new ModeConfigurationException("Cycle in mode base chain: " + String.join(" -> ", cycle));
  }

  /**
   * Creates the exception.
   *
   * @param message description
   */
  public ModeConfigurationException(String message) {
    super(message);
  }
}
