package ca.gc.cra.switchboard.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named daemon threads a bus needs: the timer that fires lock timeouts and node schedules,
 * and single workers that decouple telemetry from dispatch.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded scheduler for lock timeouts and node timers. Cancelled tasks are purged.
   *
   * @param prefix thread-name prefix
   * @return configured scheduler
   */
  public static ScheduledExecutorService newScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, daemonFactory(prefix, "switchboard-timer"));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  /**
   * Builds a single worker with an unbounded FIFO queue.
   *
   * @param prefix thread-name prefix
   * @return configured executor service
   */
  public static ExecutorService newSingleWorker(String prefix) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        daemonFactory(prefix, "switchboard-worker"));
  }

  private static ThreadFactory daemonFactory(String prefix, String fallback) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }
}
