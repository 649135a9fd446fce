/**
 * <strong>Purpose:</strong> Validation helpers used by the node model, configuration and CLI parsing.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.switchboard.validation;
