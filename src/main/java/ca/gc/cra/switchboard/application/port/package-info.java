/**
 * Ports through which the bus reaches its collaborators: metrics, clock, error telemetry, the cross-boundary
 * transport and the attribute store.
 * <p><strong>Role:</strong> Application boundary; adapters live under {@code infrastructure}.</p>
 * <p><strong>Thread-safety:</strong> Contracts document their own expectations.</p>
 */
package ca.gc.cra.switchboard.application.port;
