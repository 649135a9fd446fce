/**
 * Attribute store adapters used by node handlers to persist per-mode state.
 */
package ca.gc.cra.switchboard.infrastructure.store;
