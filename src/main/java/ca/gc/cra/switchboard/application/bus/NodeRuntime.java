package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.port.AttributeStorePort;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Bus services every instance reaches through its own methods.
 */
record NodeRuntime(
    MessageRouter router,
    DispatchGuard guard,
    ScheduledExecutorService scheduler,
    AttributeStorePort store,
    Duration lockTimeout,
    ActiveMode activeMode) {}
