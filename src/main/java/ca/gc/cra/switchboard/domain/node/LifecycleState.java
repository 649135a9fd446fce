package ca.gc.cra.switchboard.domain.node;

/**
 * Lifecycle states shared by node instances and the bus itself.
 *
 * <p>Transitions only move forward: {@code CREATED -> INITIALIZED -> STARTED -> STOPPED}.</p>
 *
 * @since 0.1.0
 */
public enum LifecycleState {
  CREATED,
  INITIALIZED,
  STARTED,
  STOPPED;

  /**
   * Checks whether this state has reached {@code other} in the forward ordering.
   *
   * @param other state to compare against
   * @return {@code true} when this state is {@code other} or later
   */
  public boolean isAtLeast(LifecycleState other) {
    return ordinal() >= other.ordinal();
  }
}
