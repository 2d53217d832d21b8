package ca.gc.cra.scout.domain.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Non-fatal problem attached to the session report.
 *
 * @param kind warning category
 * @param source component that raised the warning (source name, path, pod)
 * @param message operator facing description
 * @param timestamp when the warning was recorded
 */
public record CollectionWarning(WarningKind kind, String source, String message, Instant timestamp) {
  public CollectionWarning {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(timestamp, "timestamp");
    source = source == null ? "" : source;
    message = message == null ? "" : message;
  }
}
