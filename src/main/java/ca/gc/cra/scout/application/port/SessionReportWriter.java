package ca.gc.cra.scout.application.port;

import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.domain.session.SessionReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists the final session report and the ordered event stream.
 *
 * @since 0.1.0
 */
public interface SessionReportWriter {
  /**
   * Writes report files under {@link SessionReport#outputDirectory()}.
   *
   * @param report closed session report
   * @param events events in aggregator delivery order
   * @return files written
   * @throws IOException if a report file cannot be written
   */
  List<Path> write(SessionReport report, List<ErrorEvent> events) throws IOException;

  /** Writer that persists nothing. */
  SessionReportWriter NONE = (report, events) -> List.of();
}
