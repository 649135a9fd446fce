package ca.gc.cra.switchboard.application.port;

/**
 * Supplies wall-clock time for error timestamps.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch milliseconds.
   *
   * @return epoch milliseconds
   */
  long nowMillis();

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
