package ca.gc.cra.switchboard.application.mode;

/**
 * Raised when a mode (or a base it names) has not been defined.
 *
 * @since 0.1.0
 */
public final class UnknownModeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String mode;

  /**
   * Creates the exception.
   *
   * @param mode undefined mode name
   */
  public UnknownModeException(String mode) {
    super("Undefined mode: " + mode);
    this.mode = mode;
  }

  /**
   * Creates the exception for a base referenced by another mode.
   *
   * @param mode undefined base mode name
   * @param referencedBy mode whose {@code base} names it
   */
  public UnknownModeException(String mode, String referencedBy) {
    super("Undefined mode: " + mode + " (base of " + referencedBy + ")");
    this.mode = mode;
  }

  public String mode() {
    return mode;
  }
}
