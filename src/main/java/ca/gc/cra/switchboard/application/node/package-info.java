/**
 * Node class model: immutable class templates with flattened contracts, the registry that validates them and the
 * node-facing API handed to handlers.
 * <p><strong>Role:</strong> Application layer; the runtime in {@code application.bus} implements
 * {@link ca.gc.cra.switchboard.application.node.NodeContext}.</p>
 * <p><strong>Thread-safety:</strong> Classes are immutable; the registry synchronizes internally.</p>
 */
package ca.gc.cra.switchboard.application.node;
