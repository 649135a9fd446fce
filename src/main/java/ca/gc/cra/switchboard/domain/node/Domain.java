package ca.gc.cra.switchboard.domain.node;

import java.util.Locale;

/**
 * <strong>What:</strong> Execution-context tag attached to every node class.
 * <p><strong>Why:</strong> Two split contexts of the same process each run their own bus; the tag decides whether a
 * target class is dispatched locally or handed to the boundary transport.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Domain {
  /** Authoritative context. */
  SERVER,
  /** Presentation context. */
  CLIENT,
  /** Present in every context; never crosses the boundary. */
  SHARED;

  /**
   * Indicates whether classes tagged with this domain live on a bus running in {@code context}.
   *
   * @param context execution context of the bus; must be {@link #SERVER} or {@link #CLIENT}
   * @return {@code true} when instances of this domain are local to {@code context}
   */
  public boolean isLocalTo(Domain context) {
    return this == SHARED || this == context;
  }

  /**
   * Parses a case-insensitive domain name.
   *
   * @param raw textual domain such as {@code server}
   * @return parsed domain
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static Domain parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("domain must not be blank");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "server" -> SERVER;
      case "client" -> CLIENT;
      case "shared" -> SHARED;
      default -> throw new IllegalArgumentException("Unknown domain: " + raw);
    };
  }
}
