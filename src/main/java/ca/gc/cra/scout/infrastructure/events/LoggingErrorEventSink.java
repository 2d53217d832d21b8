package ca.gc.cra.scout.infrastructure.events;

import ca.gc.cra.scout.application.port.ErrorEventSink;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.logging.Logs;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits each detected error event as one structured log line and counts it.
 *
 * @since 0.1.0
 */
public final class LoggingErrorEventSink implements ErrorEventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingErrorEventSink.class);
  static final int MAX_MESSAGE_BYTES = 2_048;

  private final MetricsPort metrics;
  private final String metricPrefix;
  private long emitted;

  /**
   * Creates a logging sink.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code errorEvents})
   */
  public LoggingErrorEventSink(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? "errorEvents" : metricPrefix.trim();
  }

  public LoggingErrorEventSink(MetricsPort metrics) {
    this(metrics, "errorEvents");
  }

  @Override
  public void accept(ErrorEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".emitted");
    emitted++;

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("ts=" + event.timestamp());
    joiner.add("source=" + event.source());
    joiner.add("message=" + Logs.truncate(Logs.singleLine(event.message()), MAX_MESSAGE_BYTES));
    log.info("error.event {}", joiner);
  }

  @Override
  public void close() {
    log.debug("Logged {} error events", emitted);
  }
}
