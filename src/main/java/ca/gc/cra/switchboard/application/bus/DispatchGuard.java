package ca.gc.cra.switchboard.application.bus;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every operation of one bus onto a single logical thread of control.
 *
 * <p>Reentrant, so a handler running under the guard may send, spawn or wait without deadlocking.</p>
 */
final class DispatchGuard {
  private final ReentrantLock lock = new ReentrantLock();

  void run(Runnable action) {
    lock.lock();
    try {
      action.run();
    } finally {
      lock.unlock();
    }
  }

  <T> T call(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }
}
