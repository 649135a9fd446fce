package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.domain.node.HandlerNames;
import ca.gc.cra.switchboard.validation.Strings;

/**
 * Instance-level connection installed by a {@link NodeGroup}: signals fired by {@code fromId} reach {@code toId} in
 * addition to the class wiring of the active mode.
 *
 * @param fromId sending instance
 * @param signal signal to match, or {@link #ANY_SIGNAL}
 * @param toId receiving instance
 * @param handler Input handler to call instead of the derived one, or {@code null}
 * @since 0.1.0
 */
public record GroupWire(String fromId, String signal, String toId, String handler) {
  /** Matches every signal. */
  public static final String ANY_SIGNAL = "*";

  public GroupWire {
    fromId = Strings.requireNonBlank("fromId", fromId);
    signal = Strings.requireNonBlank("signal", signal);
    toId = Strings.requireNonBlank("toId", toId);
    handler = handler == null || handler.isBlank() ? null : handler.trim();
  }

  /**
   * Tests whether a fired signal travels over this wire.
   *
   * @param fired signal name
   * @return {@code true} for the wildcard or a canonical match
   */
  public boolean matches(String fired) {
    return ANY_SIGNAL.equals(signal)
        || HandlerNames.canonicalSignal(signal).equals(HandlerNames.canonicalSignal(fired));
  }
}
