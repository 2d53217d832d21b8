package ca.gc.cra.scout.domain.session;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of one time-boxed collection session.
 * <p><strong>Why:</strong> Every task receives the same value instead of reading shared mutable
 * keyword or path lists.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are defensively copied.</p>
 *
 * @param sessionId unique identifier used in logs, MDC and the output directory name
 * @param namespace Kubernetes namespace holding the workloads
 * @param podFragments ordered pod-name fragments; each must designate exactly one deployment
 * @param startedAt session creation instant
 * @param timeout upper bound on the exercising phase
 * @param pollInterval log watcher polling interval
 * @param keywords case-sensitive substrings that mark an error line
 * @param monitoredPaths paths watched by one log watcher each
 * @param outputDirectory local directory receiving artifacts and the report
 * @since 0.1.0
 */
public record CollectionSession(
    String sessionId,
    String namespace,
    List<String> podFragments,
    Instant startedAt,
    Duration timeout,
    Duration pollInterval,
    List<String> keywords,
    List<String> monitoredPaths,
    Path outputDirectory) {

  public CollectionSession {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    podFragments = List.copyOf(Objects.requireNonNull(podFragments, "podFragments"));
    keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
    monitoredPaths = List.copyOf(Objects.requireNonNull(monitoredPaths, "monitoredPaths"));
    if (sessionId.isBlank() || namespace.isBlank()) {
      throw new IllegalArgumentException("sessionId and namespace must not be blank");
    }
    if (podFragments.isEmpty()) {
      throw new IllegalArgumentException("at least one pod fragment is required");
    }
    if (keywords.isEmpty() || keywords.stream().anyMatch(String::isEmpty)) {
      throw new IllegalArgumentException("keywords must be non-empty strings");
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  /**
   * Copy of this session writing to another directory.
   *
   * @param directory replacement output directory
   * @return session identical to this one except for {@link #outputDirectory()}
   */
  public CollectionSession withOutputDirectory(Path directory) {
    return new CollectionSession(sessionId, namespace, podFragments, startedAt, timeout, pollInterval,
        keywords, monitoredPaths, directory);
  }
}
