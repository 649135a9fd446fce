package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.application.port.MetricsPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe metrics port that remembers counters and the number of observations per key.
 */
final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  long counter(String key) {
    AtomicLong value = counters.get(key);
    return value == null ? 0L : value.get();
  }

  long observationCount(String key) {
    AtomicLong value = observations.get(key);
    return value == null ? 0L : value.get();
  }
}
