/**
 * Mode definitions and their inheritance-aware resolution into wiring tables and node sets.
 */
package ca.gc.cra.switchboard.application.mode;
