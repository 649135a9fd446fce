package ca.gc.cra.switchboard.domain.node;

/**
 * Pin groups carried by every node.
 *
 * @since 0.1.0
 */
public enum Channel {
  /** Lifecycle hooks such as {@code onInit}; targeted by broadcasts. */
  SYSTEM("Sys"),
  /** Handlers reached through wiring or direct sends. */
  INPUT("In"),
  /** Declared output signals. */
  OUTPUT("Out"),
  /** Error reporting pin. */
  ERROR("Err");

  private final String label;

  Channel(String label) {
    this.label = label;
  }

  /**
   * Short pin label used in logs and error events (e.g., {@code In}).
   *
   * @return pin label
   */
  public String label() {
    return label;
  }

  /**
   * Formats a qualified handler reference such as {@code In.onFired}.
   *
   * @param handlerName handler identifier
   * @return qualified handler name
   */
  public String qualify(String handlerName) {
    return label + '.' + handlerName;
  }
}
