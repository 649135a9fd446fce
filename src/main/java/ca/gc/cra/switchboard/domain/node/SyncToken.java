package ca.gc.cra.switchboard.domain.node;

import java.util.Objects;

/**
 * Acknowledgement request attached to a message fired synchronously.
 *
 * @param correlationId identifier echoed back in the acknowledgement
 * @param replyTo instance id that awaits the acknowledgement
 * @since 0.1.0
 */
public record SyncToken(String correlationId, String replyTo) {
  /**
   * Validates the token.
   *
   * @throws NullPointerException when either field is {@code null}
   */
  public SyncToken {
    Objects.requireNonNull(correlationId, "correlationId");
    Objects.requireNonNull(replyTo, "replyTo");
  }
}
