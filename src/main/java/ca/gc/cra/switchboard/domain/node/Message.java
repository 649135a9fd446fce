package ca.gc.cra.switchboard.domain.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Ephemeral signal travelling through the router.
 * <p><strong>Why:</strong> The id identifies one propagation; every hop that forwards the message keeps it so the
 * router can refuse to deliver the same id to an instance twice.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the payload is an unmodifiable copy.</p>
 *
 * @param id monotonically increasing message id minted by the bus
 * @param signal signal name such as {@code fired}
 * @param payload unmodifiable payload; never {@code null}
 * @param sync acknowledgement request, or {@code null} for fire-and-forget messages
 * @since 0.1.0
 */
public record Message(long id, String signal, Map<String, Object> payload, SyncToken sync) {
  /**
   * Normalizes the payload into an unmodifiable insertion-ordered copy.
   *
   * @throws NullPointerException when {@code signal} is {@code null}
   * @throws IllegalArgumentException when {@code id} is not positive
   */
  public Message {
    Objects.requireNonNull(signal, "signal");
    if (id <= 0) {
      throw new IllegalArgumentException("message id must be positive");
    }
    payload = copyPayload(payload);
  }

  /**
   * Creates a fire-and-forget message.
   *
   * @param id message id
   * @param signal signal name
   * @param payload payload; {@code null} becomes empty
   * @return message without acknowledgement request
   */
  public static Message of(long id, String signal, Map<String, Object> payload) {
    return new Message(id, signal, payload, null);
  }

  /**
   * Returns the acknowledgement request when present.
   *
   * @return optional sync token
   */
  public Optional<SyncToken> syncToken() {
    return Optional.ofNullable(sync);
  }

  /**
   * Reads a payload value.
   *
   * @param key payload key
   * @return value or {@code null} when absent
   */
  public Object get(String key) {
    return payload.get(key);
  }

  /**
   * Copies a payload map, tolerating {@code null} values which {@link Map#copyOf(Map)} rejects.
   *
   * @param payload source payload; may be {@code null}
   * @return unmodifiable insertion-ordered copy
   */
  public static Map<String, Object> copyPayload(Map<String, Object> payload) {
    if (payload == null || payload.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
