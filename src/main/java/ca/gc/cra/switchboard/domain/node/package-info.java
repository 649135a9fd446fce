/**
 * Core value types of the signal bus: execution domains, pins, lifecycle states and messages.
 * <p><strong>Role:</strong> Domain layer shared by the node model, the router and adapters.</p>
 * <p><strong>Thread-safety:</strong> Types are immutable.</p>
 */
package ca.gc.cra.switchboard.domain.node;
