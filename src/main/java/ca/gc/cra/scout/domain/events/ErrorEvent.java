package ca.gc.cra.scout.domain.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Single log line (or directory entry) that matched one of the configured error keywords.
 *
 * @param timestamp instant the watcher detected the line
 * @param source identifier of the producing watcher, normally the monitored path
 * @param message matched line without its trailing newline
 * @since 0.1.0
 */
public record ErrorEvent(Instant timestamp, String source, String message) {
  public ErrorEvent {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(source, "source");
    message = message == null ? "" : message;
  }
}
