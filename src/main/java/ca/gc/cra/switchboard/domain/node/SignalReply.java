package ca.gc.cra.switchboard.domain.node;

import java.util.Map;

/**
 * Outcome of a lock: either the awaited message arrived or the wait timed out.
 *
 * <p>A timeout is a normal result, never an exception.</p>
 *
 * @param received {@code true} when the awaited signal arrived before the timeout
 * @param message the awaited message, or {@code null} on timeout
 * @since 0.1.0
 */
public record SignalReply(boolean received, Message message) {
  private static final SignalReply TIMED_OUT = new SignalReply(false, null);

  /**
   * Creates a reply carrying the awaited message.
   *
   * @param message message that resolved the wait
   * @return received reply
   */
  public static SignalReply of(Message message) {
    return new SignalReply(true, message);
  }

  /**
   * Returns the shared "no reply" sentinel.
   *
   * @return timed-out reply
   */
  public static SignalReply timedOut() {
    return TIMED_OUT;
  }

  /**
   * Indicates that the wait ended without a reply.
   *
   * @return {@code true} on timeout
   */
  public boolean isTimedOut() {
    return !received;
  }

  /**
   * Payload of the awaited message, or an empty map on timeout.
   *
   * @return reply payload
   */
  public Map<String, Object> payload() {
    return message == null ? Map.of() : message.payload();
  }
}
