/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and dispatches
 * to the tools.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 * <p><strong>Security:</strong> Rejects control characters in arguments before they reach file paths or logs.</p>
 */
package ca.gc.cra.switchboard.api;
