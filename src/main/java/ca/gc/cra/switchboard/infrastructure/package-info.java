/**
 * Adapters implementing the application ports: metrics, error telemetry, boundary transport, attribute storage and
 * executors.
 */
package ca.gc.cra.switchboard.infrastructure;
