package ca.gc.cra.scout.testutil;

import ca.gc.cra.scout.application.port.MetricsPort;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;

/** Metrics port that remembers every update. */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new LongAdder()).increment();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  public long count(String key) {
    LongAdder adder = counters.get(key);
    return adder == null ? 0L : adder.sum();
  }

  public List<Long> observed(String key) {
    return List.copyOf(observations.getOrDefault(key, List.of()));
  }
}
