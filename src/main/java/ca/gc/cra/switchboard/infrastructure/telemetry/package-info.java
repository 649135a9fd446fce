/**
 * Error telemetry adapters: structured log lines, an in-memory capture for tests and an asynchronous decorator.
 * <p><strong>Concurrency:</strong> All adapters accept events from the dispatch thread and scheduler threads.</p>
 */
package ca.gc.cra.switchboard.infrastructure.telemetry;
