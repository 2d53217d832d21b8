package ca.gc.cra.scout.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingErrorEventSinkTest {
  @Test
  void acceptLogsEventAndCountsIt() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingErrorEventSink sink = new LoggingErrorEventSink(metrics, "testEvents");

    Logger logger = (Logger) LoggerFactory.getLogger(LoggingErrorEventSink.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      sink.accept(new ErrorEvent(
          Instant.parse("2026-10-19T12:00:00Z"), "/logs.txt", "ERROR disk full\r\nat line 2"));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(1L, metrics.count("testEvents.emitted"));
    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    String message = events.get(0).getFormattedMessage();
    assertTrue(message.startsWith("error.event ts=2026-10-19T12:00:00Z"), message);
    assertTrue(message.contains("source=/logs.txt"), message);
    assertFalse(message.contains("\n"), message);
  }

  @Test
  void acceptRejectsNullEvent() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingErrorEventSink sink = new LoggingErrorEventSink(metrics);

    assertThrows(NullPointerException.class, () -> sink.accept(null));
    assertEquals(0L, metrics.count("errorEvents.emitted"));
  }
}
