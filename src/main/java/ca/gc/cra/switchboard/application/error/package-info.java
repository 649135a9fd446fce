/**
 * Centralized error collection for the bus.
 * <p><strong>Observability:</strong> Structured logs, counters and telemetry forwarding.</p>
 */
package ca.gc.cra.switchboard.application.error;
