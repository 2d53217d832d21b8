package ca.gc.cra.scout.application.port;

import ca.gc.cra.scout.domain.events.ErrorEvent;

/**
 * <strong>What:</strong> Destination for error events drained by the aggregator consumer.
 * <p><strong>Role:</strong> Outbound port implemented by the logging sink and the in-memory report
 * buffer.</p>
 * <p><strong>Thread-safety:</strong> Only the single aggregator consumer thread calls
 * {@link #accept(ErrorEvent)}; readers of accumulated state may run on other threads.</p>
 *
 * @since 0.1.0
 */
public interface ErrorEventSink extends AutoCloseable {
  /**
   * Receives one event.
   *
   * @param event detected error event; never {@code null}
   */
  void accept(ErrorEvent event);

  /** Sink that discards every event. */
  ErrorEventSink NO_OP = new ErrorEventSink() {
    @Override public void accept(ErrorEvent event) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
