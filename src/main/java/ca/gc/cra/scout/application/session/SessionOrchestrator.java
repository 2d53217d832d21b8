package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.application.evidence.EvidenceException;
import ca.gc.cra.scout.application.evidence.EvidenceHandle;
import ca.gc.cra.scout.application.evidence.EvidenceSource;
import ca.gc.cra.scout.application.evidence.EvidenceUnavailableException;
import ca.gc.cra.scout.application.port.ClockPort;
import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ErrorEventSink;
import ca.gc.cra.scout.application.port.LogTailPort;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.application.port.SessionReportWriter;
import ca.gc.cra.scout.domain.cluster.DeploymentReadiness;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.domain.session.SessionReport;
import ca.gc.cra.scout.domain.session.SessionState;
import ca.gc.cra.scout.domain.session.TaskKind;
import ca.gc.cra.scout.domain.session.WarningKind;
import ca.gc.cra.scout.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one symptom collection session from validation to report.
 * <p><strong>Lifecycle:</strong> {@code CREATED -> VALIDATING -> COLLECTING -> EXERCISING ->
 * DRAINING -> CLOSED}, or {@code VALIDATING -> VALIDATION_FAILED}.</p>
 * <ul>
 *   <li>Validation runs before anything is started; on failure no task, executor, aggregator or
 *   output directory exists.</li>
 *   <li>Instrumentation sources and one log watcher per monitored path start in
 *   {@code COLLECTING}; the exerciser starts in {@code EXERCISING}.</li>
 *   <li>Draining begins when the exerciser completes or the session timeout elapses. The stop
 *   signal is broadcast, every source is stopped, and every task is joined through the
 *   {@link TaskGroup} barrier.</li>
 *   <li>Artifacts are consolidated, then the aggregator is closed (all producers have stopped),
 *   then the report is written.</li>
 * </ul>
 * <p>Every failure other than validation is recorded as a warning on the report.</p>
 * <p><strong>Thread-safety:</strong> One session at a time per instance.</p>
 *
 * @since 0.1.0
 */
public final class SessionOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);
  private static final String SESSION_SOURCE = "session";

  private final PreflightValidator validator;
  private final List<EvidenceSource> instrumentation;
  private final EvidenceSource exerciser;
  private final LogTailPort logTail;
  private final List<ErrorEventSink> extraSinks;
  private final SessionReportWriter reportWriter;
  private final Settings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private volatile SessionState state = SessionState.CREATED;

  /**
   * Tunables that are not part of the session itself.
   *
   * @param queueCapacity aggregator buffer size
   * @param watchFromStart whether watchers inspect content present before the session started
   * @param joinTimeout how long draining waits for tasks before interrupting them
   */
  public record Settings(int queueCapacity, boolean watchFromStart, Duration joinTimeout) {
    public Settings {
      if (queueCapacity <= 0) {
        throw new IllegalArgumentException("queueCapacity must be positive");
      }
      Objects.requireNonNull(joinTimeout, "joinTimeout");
    }

    public static Settings defaults() {
      return new Settings(1024, false, Duration.ofSeconds(30));
    }
  }

  public SessionOrchestrator(
      PreflightValidator validator,
      List<EvidenceSource> instrumentation,
      EvidenceSource exerciser,
      LogTailPort logTail,
      List<ErrorEventSink> extraSinks,
      SessionReportWriter reportWriter,
      Settings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.instrumentation = List.copyOf(Objects.requireNonNull(instrumentation, "instrumentation"));
    this.exerciser = exerciser;
    this.logTail = Objects.requireNonNull(logTail, "logTail");
    this.extraSinks = extraSinks == null ? List.of() : List.copyOf(extraSinks);
    this.reportWriter = reportWriter == null ? SessionReportWriter.NONE : reportWriter;
    this.settings = settings == null ? Settings.defaults() : settings;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs a complete session.
   *
   * @param session session to run
   * @return report of the closed session
   * @throws PreflightException if validation fails; nothing was started
   * @throws ClusterException if the cluster could not be queried during validation
   * @throws IOException if the output directory cannot be created
   * @throws InterruptedException if interrupted; the session is still drained and closed first
   */
  public SessionReport run(CollectionSession session)
      throws PreflightException, IOException, InterruptedException {
    Objects.requireNonNull(session, "session");
    Thread current = Thread.currentThread();
    if (!runThread.compareAndSet(null, current)) {
      throw new IllegalStateException("a session is already running on this orchestrator");
    }
    MDC.put(TaskGroup.MDC_SESSION, session.sessionId());
    try {
      state = SessionState.CREATED;
      metrics.increment("session.started");
      validate(session);
      Files.createDirectories(session.outputDirectory());
      return collect(session);
    } finally {
      runThread.set(null);
      MDC.remove(TaskGroup.MDC_SESSION);
    }
  }

  private void validate(CollectionSession session) throws PreflightException, ClusterException {
    transition(SessionState.VALIDATING);
    try {
      List<DeploymentReadiness> readiness =
          validator.validate(session.namespace(), session.podFragments());
      for (DeploymentReadiness r : readiness) {
        log.info("Deployment {} ready ({}/{}) for '{}'",
            r.deployment(), r.readyReplicas(), r.desiredReplicas(), r.fragment());
      }
    } catch (PreflightException ex) {
      metrics.increment("session.validation.failed");
      transition(SessionState.VALIDATION_FAILED);
      log.error("Validation failed ({}): {}", ex.reason(), ex.getMessage());
      throw ex;
    } catch (ClusterException ex) {
      metrics.increment("session.validation.failed");
      transition(SessionState.VALIDATION_FAILED);
      log.error("Validation could not reach the cluster: {}", ex.getMessage());
      throw ex;
    }
  }

  private SessionReport collect(CollectionSession session) throws IOException, InterruptedException {
    WarningLog warnings = new WarningLog(clock);
    StopSignal stop = new StopSignal();
    SessionEventBuffer buffer = new SessionEventBuffer(session.monitoredPaths());
    List<ErrorEventSink> sinks = new ArrayList<>();
    sinks.add(buffer);
    sinks.addAll(extraSinks);
    ErrorAggregator aggregator = new ErrorAggregator(
        settings.queueCapacity(), sinks, metrics, "scout-aggregator-" + session.sessionId());
    ExecutorService executor = ExecutorFactories.newTaskPool("scout-" + session.sessionId(),
        (t, ex) -> log.error("Session thread {} terminated unexpectedly", t.getName(), ex));
    TaskGroup tasks = new TaskGroup(session.sessionId(), executor, stop);
    KeywordMatcher matcher = new KeywordMatcher(session.keywords());
    aggregator.start();

    List<StartedSource> started = new ArrayList<>();
    boolean exerciserCompleted = false;
    boolean timedOut = false;
    InterruptedException interruption = null;
    try {
      transition(SessionState.COLLECTING);
      for (EvidenceSource source : instrumentation) {
        startSource(source, session, tasks, warnings, started);
      }
      for (String path : session.monitoredPaths()) {
        LogWatcher watcher = new LogWatcher(path, logTail, matcher, aggregator,
            session.pollInterval(), settings.watchFromStart(), clock, warnings, metrics);
        tasks.launch("watch:" + path, TaskKind.LOG_WATCHER, watcher);
      }

      transition(SessionState.EXERCISING);
      StartedSource exercising =
          exerciser == null ? null : startSource(exerciser, session, tasks, warnings, started);
      metrics.observe("session.tasks.started", tasks.startedCount());
      log.info("Session {} collecting with {} tasks; timeout {} ms",
          session.sessionId(), tasks.startedCount(), session.timeout().toMillis());

      Outcome outcome = awaitExerciser(exercising, stop, session.timeout(), warnings);
      exerciserCompleted = outcome == Outcome.COMPLETED;
      timedOut = outcome == Outcome.TIMED_OUT;
    } catch (InterruptedException ex) {
      interruption = ex;
      warnings.record(WarningKind.PARTIAL_COLLECTION, SESSION_SOURCE, "session interrupted");
    } finally {
      String reason = interruption != null ? "interrupted" : timedOut ? "timeout" : "exerciser finished";
      boolean interruptedWhileDraining = drain(stop, tasks, started, executor, warnings, reason);
      if (interruptedWhileDraining && interruption == null) {
        interruption = new InterruptedException("interrupted while draining");
      }
    }

    List<Path> artifacts = new ArrayList<>();
    for (StartedSource s : started) {
      artifacts.addAll(s.source().consolidate(s.handle(), session.outputDirectory(), warnings));
    }

    int stoppedBeforeClose = tasks.stoppedCount();
    aggregator.close();

    SessionReport report = buildReport(session, buffer, warnings, artifacts, tasks,
        stoppedBeforeClose, exerciserCompleted, timedOut);
    try {
      report = report.withArtifacts(reportWriter.write(report, buffer.snapshot()));
    } catch (IOException ex) {
      warnings.record(WarningKind.PARTIAL_COLLECTION, SESSION_SOURCE,
          "report could not be written: " + ex.getMessage());
      report = buildReport(session, buffer, warnings, artifacts, tasks,
          stoppedBeforeClose, exerciserCompleted, timedOut);
    }
    transition(SessionState.CLOSED);
    metrics.observe("session.duration.millis", report.duration().toMillis());
    log.info("Session {} closed after {} ms: {} events, {} warnings",
        session.sessionId(), report.duration().toMillis(), report.totalEvents(), report.warnings().size());

    if (interruption != null) {
      Thread.currentThread().interrupt();
      throw interruption;
    }
    return report;
  }

  private StartedSource startSource(
      EvidenceSource source,
      CollectionSession session,
      TaskGroup tasks,
      WarningLog warnings,
      List<StartedSource> started) {
    try {
      EvidenceHandle handle = source.start(session, tasks, warnings);
      StartedSource entry = new StartedSource(source, handle);
      started.add(entry);
      return entry;
    } catch (RuntimeException ex) {
      metrics.increment("evidence.enable.failed");
      warnings.record(WarningKind.SOURCE_ENABLE, source.name(), "could not start: " + ex.getMessage());
      return null;
    }
  }

  private enum Outcome {
    COMPLETED,
    FAILED,
    TIMED_OUT
  }

  private Outcome awaitExerciser(
      StartedSource exercising, StopSignal stop, Duration timeout, WarningLog warnings)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    if (exercising == null) {
      log.info("No exerciser running; collecting until timeout");
      return collectUntilTimeout(stop, deadline, timeout, warnings, "no exerciser ran");
    }
    try {
      exercising.handle().completion().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return Outcome.COMPLETED;
    } catch (TimeoutException ex) {
      metrics.increment("session.timeout");
      warnings.record(WarningKind.TIMEOUT_EXCEEDED, exercising.source().name(),
          "did not complete within " + timeout.toMillis() + " ms");
      return Outcome.TIMED_OUT;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof EvidenceUnavailableException) {
        // the enable failure is already recorded by the source
        log.warn("Exerciser did not start ({}); collecting until timeout", cause.getMessage());
        return collectUntilTimeout(stop, deadline, timeout, warnings, "exerciser did not start");
      }
      warnings.record(WarningKind.EXERCISER_FAILED, exercising.source().name(), cause.getMessage());
      return Outcome.FAILED;
    }
  }

  private Outcome collectUntilTimeout(
      StopSignal stop, long deadline, Duration timeout, WarningLog warnings, String why)
      throws InterruptedException {
    long remaining = deadline - System.nanoTime();
    if (remaining > 0) {
      stop.await(Duration.ofNanos(remaining));
    }
    warnings.record(WarningKind.TIMEOUT_EXCEEDED, "exerciser",
        why + "; session ended after " + timeout.toMillis() + " ms");
    return Outcome.TIMED_OUT;
  }

  /**
   * Broadcasts stop, stops every source and joins every task.
   *
   * @return {@code true} if the draining thread was interrupted along the way
   */
  private boolean drain(
      StopSignal stop,
      TaskGroup tasks,
      List<StartedSource> started,
      ExecutorService executor,
      WarningLog warnings,
      String reason) {
    transition(SessionState.DRAINING);
    stop.trigger(reason);
    boolean interrupted = false;

    for (StartedSource s : started) {
      try {
        s.source().stop(s.handle());
      } catch (EvidenceException ex) {
        warnings.record(WarningKind.PARTIAL_COLLECTION, s.source().name(), ex.getMessage());
      } catch (InterruptedException ex) {
        interrupted = true;
        warnings.record(WarningKind.PARTIAL_COLLECTION, s.source().name(), "stop interrupted");
      }
    }

    boolean joined = false;
    try {
      joined = tasks.awaitAll(settings.joinTimeout());
    } catch (InterruptedException ex) {
      interrupted = true;
    }
    if (!joined) {
      warnings.record(WarningKind.PARTIAL_COLLECTION, SESSION_SOURCE,
          (tasks.startedCount() - tasks.stoppedCount()) + " tasks did not stop within "
              + settings.joinTimeout().toMillis() + " ms; interrupting");
      executor.shutdownNow();
      while (!joined) {
        try {
          joined = tasks.awaitAll(Duration.ofDays(1));
        } catch (InterruptedException ex) {
          interrupted = true;
        }
      }
    }
    executor.shutdown();

    for (TaskHandle handle : tasks.handles()) {
      if (handle.kind() == TaskKind.LOG_WATCHER && handle.failure().isPresent()) {
        warnings.record(WarningKind.PARTIAL_COLLECTION, handle.name(),
            "watcher failed: " + handle.failure().get().getMessage());
      }
    }
    log.debug("All {} tasks stopped", tasks.stoppedCount());
    return interrupted;
  }

  private SessionReport buildReport(
      CollectionSession session,
      SessionEventBuffer buffer,
      WarningLog warnings,
      List<Path> artifacts,
      TaskGroup tasks,
      int tasksStopped,
      boolean exerciserCompleted,
      boolean timedOut) {
    Instant endedAt = clock.now();
    return new SessionReport(
        session.sessionId(),
        session.namespace(),
        session.podFragments(),
        SessionState.CLOSED,
        session.startedAt(),
        endedAt.isBefore(session.startedAt()) ? session.startedAt() : endedAt,
        exerciserCompleted,
        timedOut,
        buffer.total(),
        buffer.countsBySource(),
        warnings.snapshot(),
        artifacts,
        session.outputDirectory(),
        tasks.startedCount(),
        tasksStopped);
  }

  private void transition(SessionState next) {
    SessionState previous = state;
    state = next;
    log.debug("Session state {} -> {}", previous, next);
  }

  public SessionState state() {
    return state;
  }

  private record StartedSource(EvidenceSource source, EvidenceHandle handle) {}
}
