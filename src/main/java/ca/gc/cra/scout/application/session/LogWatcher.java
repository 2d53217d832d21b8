package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.application.port.ClockPort;
import ca.gc.cra.scout.application.port.LogTailPort;
import ca.gc.cra.scout.application.port.LogTailPort.PathKind;
import ca.gc.cra.scout.application.port.LogTailPort.PathStatus;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.domain.session.WarningKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Polls one monitored path and publishes an {@link ErrorEvent} for every new
 * line containing a keyword.
 * <p><strong>Behaviour:</strong>
 * <ul>
 *   <li>The first successful poll records a baseline at the current end of file (or the current
 *   directory listing) unless {@code fromStart} is set. A path that only appears later is read
 *   from its beginning.</li>
 *   <li>A trailing line without a newline is held back until it is completed.</li>
 *   <li>A file that shrinks is treated as rotated and re-read from offset zero.</li>
 *   <li>For a directory, each new entry produces one event.</li>
 *   <li>A missing or unreadable path, or a tail port failure, is reported once per outage as a
 *   {@link WarningKind#WATCH} warning; polling continues.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single use; all state is confined to the task thread.</p>
 *
 * @since 0.1.0
 */
public final class LogWatcher implements SessionTask {
  private static final Logger log = LoggerFactory.getLogger(LogWatcher.class);
  static final int READ_CHUNK_BYTES = 64 * 1024;
  static final int MAX_BYTES_PER_POLL = 4 * 1024 * 1024;
  static final int MAX_LINE_BYTES = 1024 * 1024;

  private final String path;
  private final LogTailPort tail;
  private final KeywordMatcher matcher;
  private final ErrorAggregator aggregator;
  private final Duration pollInterval;
  private final boolean fromStart;
  private final ClockPort clock;
  private final WarningLog warnings;
  private final MetricsPort metrics;

  private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
  private boolean initialized;
  private PathKind lastKind = PathKind.MISSING;
  private long offset;
  private Set<String> knownEntries = new HashSet<>();
  private boolean unavailable;
  private long emitted;

  public LogWatcher(
      String path,
      LogTailPort tail,
      KeywordMatcher matcher,
      ErrorAggregator aggregator,
      Duration pollInterval,
      boolean fromStart,
      ClockPort clock,
      WarningLog warnings,
      MetricsPort metrics) {
    this.path = Objects.requireNonNull(path, "path");
    this.tail = Objects.requireNonNull(tail, "tail");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.fromStart = fromStart;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.warnings = Objects.requireNonNull(warnings, "warnings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void run(StopSignal stop) throws InterruptedException {
    log.debug("Watching {} every {} ms", path, pollInterval.toMillis());
    while (!stop.isTriggered()) {
      pollOnce();
      if (stop.await(pollInterval)) {
        break;
      }
    }
    log.debug("Stopped watching {} after {} events", path, emitted);
  }

  /**
   * Runs a single poll cycle.
   *
   * @throws InterruptedException if interrupted while publishing to a full aggregator
   */
  void pollOnce() throws InterruptedException {
    PathStatus status;
    try {
      status = tail.stat(path);
    } catch (IOException ex) {
      markUnavailable("unreadable: " + ex.getMessage());
      return;
    } catch (RuntimeException ex) {
      markFailed(ex);
      return;
    }
    if (status.kind() == PathKind.MISSING) {
      if (!initialized) {
        initialized = true;
        resetState();
      } else if (lastKind != PathKind.MISSING) {
        // whatever appears next is a new object
        resetState();
      }
      lastKind = PathKind.MISSING;
      markUnavailable("path does not exist");
      return;
    }
    if (initialized && status.kind() != lastKind) {
      resetState();
    }
    lastKind = status.kind();
    try {
      if (status.kind() == PathKind.FILE) {
        pollFile(status.size());
      } else {
        pollDirectory();
      }
      markAvailable();
    } catch (IOException ex) {
      markUnavailable("unreadable: " + ex.getMessage());
    } catch (RuntimeException ex) {
      markFailed(ex);
    }
  }

  private void pollFile(long size) throws IOException, InterruptedException {
    if (!initialized) {
      initialized = true;
      offset = fromStart ? 0L : size;
      if (offset > 0) {
        log.debug("Baseline for {} at {} bytes", path, offset);
      }
    }
    if (size < offset) {
      log.info("{} shrank from {} to {} bytes; reading from the start", path, offset, size);
      offset = 0L;
      partial.reset();
    }
    long remaining = Math.min(size - offset, MAX_BYTES_PER_POLL);
    while (remaining > 0) {
      int want = (int) Math.min(remaining, READ_CHUNK_BYTES);
      byte[] chunk = tail.read(path, offset, want);
      if (chunk.length == 0) {
        break;
      }
      offset += chunk.length;
      remaining -= chunk.length;
      consume(chunk);
    }
  }

  private void consume(byte[] chunk) throws InterruptedException {
    int lineStart = 0;
    for (int i = 0; i < chunk.length; i++) {
      if (chunk[i] == '\n') {
        partial.write(chunk, lineStart, i - lineStart);
        emitLine();
        lineStart = i + 1;
      }
    }
    if (lineStart < chunk.length) {
      partial.write(chunk, lineStart, chunk.length - lineStart);
      if (partial.size() > MAX_LINE_BYTES) {
        emitLine();
      }
    }
  }

  private void emitLine() throws InterruptedException {
    String line = partial.toString(StandardCharsets.UTF_8);
    partial.reset();
    if (line.endsWith("\r")) {
      line = line.substring(0, line.length() - 1);
    }
    if (matcher.matches(line)) {
      publish(line);
    }
  }

  private void pollDirectory() throws IOException, InterruptedException {
    List<String> names = tail.list(path);
    if (!initialized) {
      initialized = true;
      if (!fromStart) {
        knownEntries = new HashSet<>(names);
        return;
      }
    }
    List<String> fresh = new ArrayList<>();
    for (String name : names) {
      if (knownEntries.add(name)) {
        fresh.add(name);
      }
    }
    Collections.sort(fresh);
    for (String name : fresh) {
      publish("new entry " + name);
    }
  }

  private void publish(String message) throws InterruptedException {
    aggregator.publish(new ErrorEvent(clock.now(), path, message));
    emitted++;
  }

  private void resetState() {
    offset = 0L;
    partial.reset();
    knownEntries = new HashSet<>();
  }

  private void markUnavailable(String reason) {
    metrics.increment("watcher.poll.error");
    if (unavailable) {
      log.debug("{} still unavailable: {}", path, reason);
      return;
    }
    unavailable = true;
    warnings.record(WarningKind.WATCH, path, reason);
  }

  private void markFailed(RuntimeException ex) {
    if (!unavailable) {
      log.warn("Polling {} failed; retrying every {} ms", path, pollInterval.toMillis(), ex);
    }
    markUnavailable("poll failed: " + ex.getMessage());
  }

  private void markAvailable() {
    if (unavailable) {
      unavailable = false;
      log.info("{} is available again", path);
    }
  }

  public String path() {
    return path;
  }

  long emittedCount() {
    return emitted;
  }
}
