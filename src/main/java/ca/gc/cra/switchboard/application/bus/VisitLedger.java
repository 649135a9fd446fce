package ca.gc.cra.switchboard.application.bus;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks which instances each in-flight message id has reached.
 *
 * <p>Every routing pass for an id opens and closes it; nested passes (a handler forwarding the message it is
 * handling) share the same visited set. The set is discarded when the outermost pass closes.</p>
 *
 * <p>Not thread-safe; accessed under the {@link DispatchGuard}.</p>
 */
final class VisitLedger {
  private final Map<Long, Visits> inFlight = new HashMap<>();

  void open(long messageId) {
    inFlight.computeIfAbsent(messageId, id -> new Visits()).depth++;
  }

  void close(long messageId) {
    Visits visits = inFlight.get(messageId);
    if (visits == null) {
      throw new IllegalStateException("Message " + messageId + " is not in flight");
    }
    if (--visits.depth == 0) {
      inFlight.remove(messageId);
    }
  }

  boolean hasVisited(long messageId, String instanceId) {
    Visits visits = inFlight.get(messageId);
    return visits != null && visits.instances.contains(instanceId);
  }

  /**
   * Marks an instance as reached by a message id.
   *
   * @return {@code false} when the instance was already reached
   */
  boolean markVisited(long messageId, String instanceId) {
    Visits visits = inFlight.get(messageId);
    if (visits == null) {
      throw new IllegalStateException("Message " + messageId + " is not in flight");
    }
    return visits.instances.add(instanceId);
  }

  int inFlightCount() {
    return inFlight.size();
  }

  private static final class Visits {
    private final Set<String> instances = new HashSet<>();
    private int depth;
  }
}
