package ca.gc.cra.scout.application.port;

/**
 * <strong>What:</strong> Port abstracting SCOUT metrics emission.
 * <p><strong>Why:</strong> Lets the orchestrator and watchers count events and time phases without
 * binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from watcher,
 * evidence and aggregator threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g.
 * {@code aggregator.events}, {@code session.duration.millis}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (milliseconds, nanoseconds, counts) as defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
