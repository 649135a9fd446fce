/**
 * Boundary transport adapters carrying signals between the server and client execution contexts.
 */
package ca.gc.cra.switchboard.infrastructure.transport;
