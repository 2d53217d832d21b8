package ca.gc.cra.scout.domain.session;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a closed session.
 *
 * @param sessionId session identifier
 * @param namespace target namespace
 * @param podFragments fragments the session validated
 * @param finalState terminal state reached
 * @param startedAt session start
 * @param endedAt instant the report was produced
 * @param exerciserCompleted whether the exerciser signalled completion before the timeout
 * @param timedOut whether draining was triggered by the session timeout
 * @param totalEvents number of error events delivered by the aggregator
 * @param eventsBySource per-watcher event counts in path order; sources without events map to zero
 * @param warnings non-fatal problems in the order they were recorded
 * @param artifacts files written under the output directory
 * @param outputDirectory output directory
 * @param tasksStarted tasks registered with the join barrier
 * @param tasksStopped tasks that acknowledged stop before the session closed
 * @since 0.1.0
 */
public record SessionReport(
    String sessionId,
    String namespace,
    List<String> podFragments,
    SessionState finalState,
    Instant startedAt,
    Instant endedAt,
    boolean exerciserCompleted,
    boolean timedOut,
    long totalEvents,
    Map<String, Long> eventsBySource,
    List<CollectionWarning> warnings,
    List<Path> artifacts,
    Path outputDirectory,
    int tasksStarted,
    int tasksStopped) {

  public SessionReport {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(finalState, "finalState");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(endedAt, "endedAt");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    podFragments = List.copyOf(Objects.requireNonNull(podFragments, "podFragments"));
    eventsBySource = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(eventsBySource, "eventsBySource")));
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    artifacts = List.copyOf(Objects.requireNonNull(artifacts, "artifacts"));
  }

  /**
   * Copy of this report with {@code extra} appended to its artifacts; paths already listed are
   * not repeated.
   *
   * @param extra additional artifact files
   * @return report with the combined artifact list
   */
  public SessionReport withArtifacts(List<Path> extra) {
    List<Path> combined = new ArrayList<>(artifacts);
    for (Path path : extra) {
      if (!combined.contains(path)) {
        combined.add(path);
      }
    }
    return new SessionReport(sessionId, namespace, podFragments, finalState, startedAt, endedAt,
        exerciserCompleted, timedOut, totalEvents, eventsBySource, warnings, combined,
        outputDirectory, tasksStarted, tasksStopped);
  }

  public Duration duration() {
    return Duration.between(startedAt, endedAt);
  }

  public long eventCount(String source) {
    Long count = eventsBySource.get(source);
    return count == null ? 0L : count;
  }

  public boolean hasWarning(WarningKind kind) {
    return warnings.stream().anyMatch(w -> w.kind() == kind);
  }

  /**
   * Indicates whether any task failed to stop cleanly or left artifacts behind.
   *
   * @return {@code true} when a {@link WarningKind#PARTIAL_COLLECTION} warning was recorded
   */
  public boolean hasPartialErrors() {
    return hasWarning(WarningKind.PARTIAL_COLLECTION);
  }
}
