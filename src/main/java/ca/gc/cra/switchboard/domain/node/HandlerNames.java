package ca.gc.cra.switchboard.domain.node;

import java.util.Locale;
import java.util.Optional;

/**
 * Naming rule linking signals to handler identifiers: signal {@code fired} maps to handler {@code onFired}.
 *
 * @since 0.1.0
 */
public final class HandlerNames {
  /** Handler prefix shared by every pin. */
  public static final String PREFIX = "on";
  /** Reserved signal carrying acknowledgements for synchronous fires. */
  public static final String ACK_SIGNAL = "_ack";
  /** System signal broadcast before a mode switch commits. */
  public static final String MODE_CHANGE_SIGNAL = "modeChange";

  private HandlerNames() {
    // Utility
  }

  /**
   * Derives the handler name for a signal.
   *
   * @param signal signal name; must not be blank
   * @return handler identifier such as {@code onFired}
   * @throws IllegalArgumentException when {@code signal} is blank
   */
  public static String forSignal(String signal) {
    if (signal == null || signal.isBlank()) {
      throw new IllegalArgumentException("signal must not be blank");
    }
    return PREFIX + signal.substring(0, 1).toUpperCase(Locale.ROOT) + signal.substring(1);
  }

  /**
   * Reverses the naming rule, returning the canonical signal a handler answers to.
   *
   * @param handlerName handler identifier such as {@code onFired}
   * @return signal such as {@code fired}, or empty when the name does not follow the rule
   */
  public static Optional<String> signalFor(String handlerName) {
    if (handlerName == null
        || handlerName.length() <= PREFIX.length()
        || !handlerName.startsWith(PREFIX)
        || !Character.isUpperCase(handlerName.charAt(PREFIX.length()))) {
      return Optional.empty();
    }
    return Optional.of(canonicalSignal(handlerName.substring(PREFIX.length())));
  }

  /**
   * Normalizes a signal so that {@code Fired} and {@code fired} share one route.
   *
   * @param signal raw signal name
   * @return signal with a lower-case first character
   */
  public static String canonicalSignal(String signal) {
    if (signal == null || signal.isEmpty()) {
      return signal;
    }
    return signal.substring(0, 1).toLowerCase(Locale.ROOT) + signal.substring(1);
  }
}
