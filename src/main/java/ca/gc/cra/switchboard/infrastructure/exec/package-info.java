/**
 * Executor factories for bus timers and telemetry workers.
 * <p><strong>Concurrency:</strong> Threads are named daemons so an unclosed bus never blocks JVM exit.</p>
 */
package ca.gc.cra.switchboard.infrastructure.exec;
