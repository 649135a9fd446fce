package ca.gc.cra.switchboard.application.node;

import java.util.Map;

/**
 * Error pin of a node; reports land in the bus error collector.
 *
 * @since 0.1.0
 */
public interface ErrorChannel {
  /**
   * Reports a failure described by text.
   *
   * @param error failure summary
   * @param details structured context; may be {@code null}
   */
  void fire(String error, Map<String, Object> details);

  /**
   * Reports a caught exception.
   *
   * @param error exception raised inside the node
   * @param details structured context; may be {@code null}
   */
  void fire(Throwable error, Map<String, Object> details);
}
