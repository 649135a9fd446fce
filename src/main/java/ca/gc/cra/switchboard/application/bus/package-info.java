/**
 * Bus runtime: node instances, the message router, mode switching, lifecycle orchestration and node groups, all
 * behind {@link ca.gc.cra.switchboard.application.bus.SignalBus}.
 * <p><strong>Concurrency:</strong> One reentrant dispatch guard per bus; dispatch is synchronous and handlers may call
 * back into the bus. Lock timeouts and node timers fire on a scheduler thread and re-enter under the guard.</p>
 * <p><strong>Metrics:</strong> {@code router.*} and {@code lifecycle.*} counters through
 * {@link ca.gc.cra.switchboard.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.switchboard.application.bus;
