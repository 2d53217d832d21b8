package ca.gc.cra.scout.infrastructure.report;

import ca.gc.cra.scout.application.port.SessionReportWriter;
import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.domain.session.CollectionWarning;
import ca.gc.cra.scout.domain.session.SessionReport;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code report.json}, {@code events.ndjson} and {@code summary.txt} into the session
 * output directory.
 *
 * <p>Each file is written to a temporary sibling and moved into place, so a reader never sees a
 * half-written report. The artifact list in {@code report.json} and {@code summary.txt} includes
 * these three files.</p>
 *
 * @since 0.1.0
 */
public final class JsonSessionReportWriter implements SessionReportWriter {
  private static final Logger log = LoggerFactory.getLogger(JsonSessionReportWriter.class);
  public static final String REPORT_FILE = "report.json";
  public static final String EVENTS_FILE = "events.ndjson";
  public static final String SUMMARY_FILE = "summary.txt";
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public List<Path> write(SessionReport report, List<ErrorEvent> events) throws IOException {
    Path dir = report.outputDirectory();
    Files.createDirectories(dir);
    Path reportFile = dir.resolve(REPORT_FILE);
    Path eventsFile = dir.resolve(EVENTS_FILE);
    Path summaryFile = dir.resolve(SUMMARY_FILE);
    List<Path> files = List.of(reportFile, eventsFile, summaryFile);
    // the report lists its own files, as the caller's final report does
    SessionReport complete = report.withArtifacts(files);

    writeAtomically(reportFile, out -> writeReport(complete, out));
    writeAtomically(eventsFile, out -> writeEvents(events, out));
    writeAtomically(summaryFile, out -> {
      try (Writer writer = new BufferedWriter(
          new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
        writer.write(summary(complete));
      }
    });
    log.info("Session report written to {}", dir);
    return files;
  }

  private void writeReport(SessionReport report, OutputStream out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("sessionId", report.sessionId());
      gen.writeStringField("namespace", report.namespace());
      gen.writeArrayFieldStart("pods");
      for (String fragment : report.podFragments()) {
        gen.writeString(fragment);
      }
      gen.writeEndArray();
      gen.writeStringField("finalState", report.finalState().name());
      gen.writeStringField("startedAt", report.startedAt().toString());
      gen.writeStringField("endedAt", report.endedAt().toString());
      gen.writeNumberField("durationMillis", report.duration().toMillis());
      gen.writeBooleanField("exerciserCompleted", report.exerciserCompleted());
      gen.writeBooleanField("timedOut", report.timedOut());
      gen.writeNumberField("tasksStarted", report.tasksStarted());
      gen.writeNumberField("tasksStopped", report.tasksStopped());
      gen.writeNumberField("totalEvents", report.totalEvents());
      gen.writeObjectFieldStart("eventsBySource");
      for (Map.Entry<String, Long> entry : report.eventsBySource().entrySet()) {
        gen.writeNumberField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();
      gen.writeArrayFieldStart("warnings");
      for (CollectionWarning warning : report.warnings()) {
        gen.writeStartObject();
        gen.writeStringField("kind", warning.kind().name());
        gen.writeStringField("source", warning.source());
        gen.writeStringField("message", warning.message());
        gen.writeStringField("timestamp", warning.timestamp().toString());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("artifacts");
      for (Path artifact : report.artifacts()) {
        gen.writeString(relativize(report.outputDirectory(), artifact));
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private void writeEvents(List<ErrorEvent> events, OutputStream out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.setRootValueSeparator(null);
      for (ErrorEvent event : events) {
        gen.writeStartObject();
        gen.writeStringField("timestamp", event.timestamp().toString());
        gen.writeStringField("source", event.source());
        gen.writeStringField("message", event.message());
        gen.writeEndObject();
        gen.writeRaw('\n');
      }
    }
  }

  /**
   * Renders the human-readable session summary written to {@code summary.txt}.
   *
   * @param report closed session report
   * @return multi-line summary ending with a newline
   */
  public static String summary(SessionReport report) {
    StringBuilder sb = new StringBuilder(256);
    sb.append("Session ").append(report.sessionId()).append(" (").append(report.finalState()).append(")\n");
    sb.append("Namespace: ").append(report.namespace()).append('\n');
    sb.append("Pods: ").append(String.join(" ", report.podFragments())).append('\n');
    sb.append("Duration: ").append(report.duration().toMillis()).append(" ms\n");
    sb.append("Exerciser completed: ").append(report.exerciserCompleted() ? "yes" : "no");
    if (report.timedOut()) {
      sb.append(" (timed out)");
    }
    sb.append('\n');
    sb.append("Error events: ").append(report.totalEvents()).append('\n');
    for (Map.Entry<String, Long> entry : report.eventsBySource().entrySet()) {
      sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
    }
    if (!report.warnings().isEmpty()) {
      sb.append("Warnings: ").append(report.warnings().size()).append('\n');
      for (CollectionWarning warning : report.warnings()) {
        sb.append("  [").append(warning.kind()).append("] ");
        if (!warning.source().isEmpty()) {
          sb.append(warning.source()).append(": ");
        }
        sb.append(warning.message()).append('\n');
      }
    }
    if (!report.artifacts().isEmpty()) {
      sb.append("Artifacts:\n");
      for (Path artifact : report.artifacts()) {
        sb.append("  ").append(relativize(report.outputDirectory(), artifact)).append('\n');
      }
    }
    return sb.toString();
  }

  private static String relativize(Path base, Path artifact) {
    Path absolute = artifact.toAbsolutePath().normalize();
    Path root = base.toAbsolutePath().normalize();
    return absolute.startsWith(root)
        ? root.relativize(absolute).toString().replace('\\', '/')
        : absolute.toString();
  }

  private static void writeAtomically(Path target, Body body) throws IOException {
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    try (OutputStream out = Files.newOutputStream(tmp)) {
      body.writeTo(out);
    } catch (IOException ex) {
      Files.deleteIfExists(tmp);
      throw ex;
    }
    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }

  @FunctionalInterface
  private interface Body {
    void writeTo(OutputStream out) throws IOException;
  }
}
