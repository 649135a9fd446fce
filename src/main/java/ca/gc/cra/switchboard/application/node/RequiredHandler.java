package ca.gc.cra.switchboard.application.node;

import ca.gc.cra.switchboard.domain.node.Channel;
import java.util.Objects;

/**
 * Handler a class contract demands, together with the class that introduced the requirement.
 *
 * @param channel pin the handler belongs to
 * @param handler handler identifier
 * @param requiredBy class that declared the requirement
 * @since 0.1.0
 */
public record RequiredHandler(Channel channel, String handler, String requiredBy) {
  /**
   * Validates fields.
   */
  public RequiredHandler {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(requiredBy, "requiredBy");
  }

  /**
   * Formats the handler as {@code Sys.onInit}.
   *
   * @return qualified handler name
   */
  public String qualifiedName() {
    return channel.qualify(handler);
  }
}
