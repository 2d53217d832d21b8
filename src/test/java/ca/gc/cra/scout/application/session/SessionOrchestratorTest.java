package ca.gc.cra.scout.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scout.application.evidence.CaptureEvidenceSource;
import ca.gc.cra.scout.application.evidence.EvidenceSource;
import ca.gc.cra.scout.application.evidence.ExerciserEvidenceSource;
import ca.gc.cra.scout.application.evidence.PodCommandSettings;
import ca.gc.cra.scout.application.evidence.TraceEvidenceSource;
import ca.gc.cra.scout.application.port.ClockPort;
import ca.gc.cra.scout.application.port.SessionReportWriter;
import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.domain.session.CollectionWarning;
import ca.gc.cra.scout.domain.session.SessionReport;
import ca.gc.cra.scout.domain.session.SessionState;
import ca.gc.cra.scout.domain.session.WarningKind;
import ca.gc.cra.scout.infrastructure.report.JsonSessionReportWriter;
import ca.gc.cra.scout.testutil.FakeClusterPort;
import ca.gc.cra.scout.testutil.FakePodExecPort;
import ca.gc.cra.scout.testutil.InMemoryLogTail;
import ca.gc.cra.scout.testutil.RecordingMetricsPort;
import ca.gc.cra.scout.testutil.RecordingSink;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionOrchestratorTest {
  private static final String NS = "default";
  private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(2);
  private static final Duration EXERCISE_TIME = Duration.ofMillis(300);
  private static final Duration POLL = Duration.ofMillis(20);
  // startup, trace/capture disable and report files on top of the timeout
  private static final Duration DRAIN_SLACK = Duration.ofMillis(1500);

  @TempDir Path tempDir;

  private FakeClusterPort cluster;
  private FakePodExecPort exec;
  private InMemoryLogTail tail;
  private RecordingSink sink;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    cluster = new FakeClusterPort()
        .withReadyWorkload(NS, "uecm")
        .withReadyWorkload(NS, "gateway")
        .withReadyWorkload(NS, "testclient");
    exec = new FakePodExecPort();
    tail = new InMemoryLogTail();
    sink = new RecordingSink();
    metrics = new RecordingMetricsPort();
  }

  private CollectionSession session(List<String> paths, Duration timeout) {
    return new CollectionSession("s-test", NS, List.of("uecm", "gateway"),
        Instant.now(), timeout, POLL, List.of("ERROR"), paths,
        tempDir.resolve("out"));
  }

  private SessionOrchestrator orchestrator(boolean withExerciser, int queueCapacity, boolean fromStart) {
    return orchestrator(withExerciser, queueCapacity, fromStart, new JsonSessionReportWriter());
  }

  private SessionOrchestrator orchestrator(
      boolean withExerciser, int queueCapacity, boolean fromStart, SessionReportWriter writer) {
    PodCommandSettings trace = new PodCommandSettings(true, "trace-enable {session}",
        "trace-disable {session}", "/tmp/scout/{session}/trace.tar.gz", COMMAND_TIMEOUT, COMMAND_TIMEOUT);
    PodCommandSettings capture = new PodCommandSettings(true, "capture-enable {pod}",
        "capture-disable {pod}", "/tmp/scout/{session}/capture.pcap", COMMAND_TIMEOUT, COMMAND_TIMEOUT);
    PodCommandSettings exerciserSettings = new PodCommandSettings(true,
        "pybot --outputdir /tmp/scout/{session} /opt/tests", "", "/tmp/scout/{session}/log.html",
        COMMAND_TIMEOUT, COMMAND_TIMEOUT);
    List<EvidenceSource> instrumentation = List.of(
        new TraceEvidenceSource(cluster, exec, trace, metrics),
        new CaptureEvidenceSource(cluster, exec, capture, metrics));
    EvidenceSource exerciser = withExerciser
        ? new ExerciserEvidenceSource(cluster, exec, "testclient", exerciserSettings, metrics)
        : null;
    return new SessionOrchestrator(new PreflightValidator(cluster), instrumentation, exerciser, tail,
        List.of(sink), writer,
        new SessionOrchestrator.Settings(queueCapacity, fromStart, Duration.ofSeconds(2)),
        ClockPort.SYSTEM, metrics);
  }

  @Test
  void validationFailureStartsNothing() {
    CollectionSession session = new CollectionSession("s-invalid", NS, List.of("uecm", "missing"),
        Instant.now(), Duration.ofSeconds(5), Duration.ofMillis(20), List.of("ERROR"),
        List.of("/var/log/app.log"), tempDir.resolve("invalid"));
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    PreflightException ex = assertThrows(PreflightException.class, () -> orchestrator.run(session));

    assertEquals(PreflightException.Reason.DEPLOYMENT_NOT_FOUND, ex.reason());
    assertEquals(SessionState.VALIDATION_FAILED, orchestrator.state());
    assertTrue(exec.calls().isEmpty());
    assertTrue(sink.events().isEmpty());
    assertEquals(0, sink.closeCount());
    assertFalse(Files.exists(tempDir.resolve("invalid")));
    assertEquals(1, metrics.count("session.validation.failed"));
  }

  @Test
  void missingNamespaceFailsValidation() {
    CollectionSession base = session(List.of("/a"), Duration.ofSeconds(5));
    CollectionSession session = new CollectionSession(base.sessionId(), "nowhere", base.podFragments(),
        base.startedAt(), base.timeout(), base.pollInterval(), base.keywords(), base.monitoredPaths(),
        base.outputDirectory());
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    PreflightException ex = assertThrows(PreflightException.class, () -> orchestrator.run(session));

    assertEquals(PreflightException.Reason.NAMESPACE_NOT_FOUND, ex.reason());
    assertTrue(exec.calls().isEmpty());
  }

  @Test
  void exerciserCompletionEndsSessionEarly() throws Exception {
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofSeconds(30)));

    assertEquals(SessionState.CLOSED, report.finalState());
    assertEquals(SessionState.CLOSED, orchestrator.state());
    assertTrue(report.exerciserCompleted());
    assertFalse(report.timedOut());
    assertTrue(report.duration().compareTo(Duration.ofSeconds(20)) < 0);
    assertEquals(report.tasksStarted(), report.tasksStopped());
    // trace, capture, exerciser, one watcher
    assertEquals(4, report.tasksStarted());
    assertEquals(2, exec.count("trace-enable s-test"));
    assertEquals(2, exec.count("trace-disable s-test"));
    assertEquals(2, exec.count("capture-disable"));

    Path out = tempDir.resolve("out");
    assertTrue(Files.exists(out.resolve(JsonSessionReportWriter.REPORT_FILE)));
    assertTrue(Files.exists(out.resolve("trace").resolve("uecm-5d8c7b9f4-x2kq").resolve("trace.tar.gz")));
    assertTrue(Files.exists(out.resolve("capture").resolve("gateway-5d8c7b9f4-x2kq").resolve("capture.pcap")));
    assertTrue(Files.exists(out.resolve("exerciser").resolve("testclient-5d8c7b9f4-x2kq").resolve("log.html")));
    assertTrue(report.artifacts().contains(out.resolve(JsonSessionReportWriter.REPORT_FILE)));
    assertEquals(JsonSessionReportWriter.summary(report),
        Files.readString(out.resolve(JsonSessionReportWriter.SUMMARY_FILE), StandardCharsets.UTF_8));
  }

  @Test
  void timeoutDrainsAndCancelsTheExerciser() throws Exception {
    exec.hang("pybot");
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofMillis(300)));

    assertTrue(report.timedOut());
    assertFalse(report.exerciserCompleted());
    assertTrue(report.hasWarning(WarningKind.TIMEOUT_EXCEEDED));
    assertEquals(1, exec.cancelledCount());
    assertTrue(report.duration().compareTo(Duration.ofMillis(300)) >= 0);
    assertWithinTimeoutBound(report, Duration.ofMillis(300));
    assertEquals(report.tasksStarted(), report.tasksStopped());
    assertEquals(1, metrics.count("session.timeout"));
  }

  @Test
  void withoutExerciserSessionRunsUntilTimeout() throws Exception {
    SessionOrchestrator orchestrator = orchestrator(false, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofMillis(200)));

    assertTrue(report.timedOut());
    assertTrue(report.hasWarning(WarningKind.TIMEOUT_EXCEEDED));
    assertTrue(report.duration().compareTo(Duration.ofMillis(200)) >= 0);
    assertWithinTimeoutBound(report, Duration.ofMillis(200));
    assertEquals(3, report.tasksStarted());
    assertEquals(0, exec.count("pybot"));
  }

  @Test
  void missingExerciserPodKeepsCollectingUntilTimeout() throws Exception {
    cluster = new FakeClusterPort()
        .withReadyWorkload(NS, "uecm")
        .withReadyWorkload(NS, "gateway");
    tail.append("/var/log/app.log", "");
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofMillis(600)));

    assertTrue(report.timedOut());
    assertFalse(report.exerciserCompleted());
    assertTrue(report.duration().compareTo(Duration.ofMillis(600)) >= 0);
    assertWithinTimeoutBound(report, Duration.ofMillis(600));
    assertTrue(report.warnings().stream().anyMatch(
        w -> w.kind() == WarningKind.SOURCE_ENABLE && w.source().equals("exerciser")));
    assertFalse(report.hasWarning(WarningKind.EXERCISER_FAILED));
    assertTrue(report.hasWarning(WarningKind.TIMEOUT_EXCEEDED));
    assertTrue(tail.statCount("/var/log/app.log") >= 10, "polls: " + tail.statCount("/var/log/app.log"));
    assertEquals(0, exec.count("pybot"));
    assertEquals(2, exec.count("trace-disable s-test"));
  }

  @Test
  void failedExerciserIsRecordedAndEndsSession() throws Exception {
    exec.exitWith("pybot", 3);
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofSeconds(30)));

    assertFalse(report.exerciserCompleted());
    assertFalse(report.timedOut());
    assertTrue(report.hasWarning(WarningKind.EXERCISER_FAILED));
    assertEquals(SessionState.CLOSED, report.finalState());
  }

  @Test
  void eventsAreCountedPerPathIncludingQuietOnes() throws Exception {
    tail.append("/a", "fine\n")
        .append("/b", "")
        .append("/c", "ERROR one\nok\nERROR two\n");
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 16, true);

    SessionReport report = orchestrator.run(
        session(List.of("/a", "/b", "/c", "/d", "/e"), Duration.ofSeconds(30)));

    assertEquals(2, report.totalEvents());
    assertEquals(List.of("/a", "/b", "/c", "/d", "/e"), List.copyOf(report.eventsBySource().keySet()));
    assertEquals(Map.of("/a", 0L, "/b", 0L, "/c", 2L, "/d", 0L, "/e", 0L), report.eventsBySource());
    assertEquals(2, report.warnings().stream()
        .filter(w -> w.kind() == WarningKind.WATCH).count());
    assertEquals(2, sink.events().size());
    assertEquals(8, report.tasksStarted());
  }

  @Test
  void burstLargerThanQueueCapacityLosesNothing() throws Exception {
    StringBuilder burst = new StringBuilder();
    for (int i = 0; i < 500; i++) {
      burst.append("ERROR burst ").append(i).append('\n');
    }
    tail.append("/burst", burst.toString());
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 2, true);

    SessionReport report = orchestrator.run(session(List.of("/burst"), Duration.ofSeconds(30)));

    assertEquals(500, report.totalEvents());
    assertEquals(500, sink.events().size());
    assertEquals("ERROR burst 0", sink.events().get(0).message());
    assertEquals("ERROR burst 499", sink.events().get(499).message());
    assertTrue(metrics.count("aggregator.backpressure") > 0);
  }

  @Test
  void enableFailureIsRecordedAndSessionContinues() throws Exception {
    exec.exitWith("trace-enable", 1);
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofSeconds(30)));

    assertEquals(SessionState.CLOSED, report.finalState());
    assertTrue(report.exerciserCompleted());
    List<CollectionWarning> enableWarnings = report.warnings().stream()
        .filter(w -> w.kind() == WarningKind.SOURCE_ENABLE)
        .collect(Collectors.toList());
    assertEquals(2, enableWarnings.size());
    assertTrue(enableWarnings.stream().allMatch(w -> w.source().equals("trace")));
    assertEquals(0, exec.count("trace-disable"));
    assertEquals(2, exec.count("capture-disable"));
  }

  @Test
  void disableFailureMarksCollectionPartial() throws Exception {
    exec.exitWith("capture-disable", 1);
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofSeconds(30)));

    assertEquals(SessionState.CLOSED, report.finalState());
    assertTrue(report.hasPartialErrors());
    assertTrue(report.warnings().stream().anyMatch(
        w -> w.kind() == WarningKind.PARTIAL_COLLECTION && w.source().equals("capture")));
  }

  @Test
  void missingArtifactIsRecordedAsPartial() throws Exception {
    exec.missingArtifact("trace.tar.gz");
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 16, false);

    SessionReport report = orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofSeconds(30)));

    assertEquals(2, report.warnings().stream()
        .filter(w -> w.kind() == WarningKind.PARTIAL_COLLECTION && w.source().equals("trace"))
        .count());
    assertFalse(Files.exists(tempDir.resolve("out").resolve("trace")));
  }

  @Test
  void aggregatorClosesOnlyAfterEveryTaskStopped() throws Exception {
    tail.append("/c", "ERROR early\n");
    exec.completeAfter("pybot", EXERCISE_TIME, 0);
    SessionOrchestrator orchestrator = orchestrator(true, 16, true);

    SessionReport report = orchestrator.run(session(List.of("/c"), Duration.ofSeconds(30)));

    assertEquals(report.tasksStarted(), report.tasksStopped());
    assertEquals(1, sink.closeCount());
    assertEquals(1, report.totalEvents());
    assertEquals(1, metrics.observed("session.duration.millis").size());
  }

  @Test
  void interruptDuringExercisingStillDrainsAndCloses() throws Exception {
    exec.hang("pybot");
    tail.append("/var/log/app.log", "");
    AtomicReference<SessionReport> written = new AtomicReference<>();
    SessionReportWriter json = new JsonSessionReportWriter();
    SessionOrchestrator orchestrator = orchestrator(true, 16, false, (report, events) -> {
      written.set(report);
      return json.write(report, events);
    });
    AtomicReference<Throwable> thrown = new AtomicReference<>();
    Thread runner = new Thread(() -> {
      try {
        orchestrator.run(session(List.of("/var/log/app.log"), Duration.ofSeconds(30)));
      } catch (Throwable ex) {
        thrown.set(ex);
      }
    }, "session-under-test");

    runner.start();
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    while ((orchestrator.state() != SessionState.EXERCISING || exec.count("pybot") == 0)
        && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    runner.interrupt();
    runner.join(Duration.ofSeconds(20).toMillis());

    assertFalse(runner.isAlive());
    assertInstanceOf(InterruptedException.class, thrown.get());
    assertEquals(SessionState.CLOSED, orchestrator.state());
    SessionReport report = written.get();
    assertNotNull(report);
    assertEquals(report.tasksStarted(), report.tasksStopped());
    assertEquals(1, sink.closeCount());
    assertEquals(0, sink.acceptedAfterClose());
    assertEquals(1, exec.cancelledCount());
    assertEquals(2, exec.count("trace-disable s-test"));
    assertTrue(report.warnings().stream().anyMatch(
        w -> w.kind() == WarningKind.PARTIAL_COLLECTION && w.message().contains("interrupted")));
    assertTrue(Files.exists(tempDir.resolve("out").resolve(JsonSessionReportWriter.REPORT_FILE)));
  }

  @RepeatedTest(5)
  void stopDuringConcurrentBurstsClosesAggregatorAfterJoin() throws Exception {
    List<String> paths = List.of("/p1", "/p2", "/p3", "/p4");
    for (String path : paths) {
      StringBuilder burst = new StringBuilder();
      for (int i = 0; i < 2000; i++) {
        burst.append("ERROR ").append(path).append(' ').append(i).append('\n');
      }
      tail.append(path, burst.toString());
    }
    exec.completeAfter("pybot", Duration.ofMillis(ThreadLocalRandom.current().nextInt(1, 40)), 0);
    SessionOrchestrator orchestrator = orchestrator(true, 4, true);

    SessionReport report = orchestrator.run(session(paths, Duration.ofSeconds(30)));

    assertEquals(report.tasksStarted(), report.tasksStopped());
    assertEquals(1, sink.closeCount());
    assertEquals(0, sink.acceptedAfterClose());
    assertEquals(report.totalEvents(), sink.events().size());
    for (String path : paths) {
      List<String> delivered = sink.events().stream()
          .filter(e -> e.source().equals(path))
          .map(ErrorEvent::message)
          .collect(Collectors.toList());
      assertEquals(report.eventsBySource().get(path).longValue(), delivered.size());
      for (int i = 0; i < delivered.size(); i++) {
        assertEquals("ERROR " + path + " " + i, delivered.get(i));
      }
    }
    assertFalse(report.warnings().stream().anyMatch(w -> w.message().contains("did not stop")));
  }

  private static void assertWithinTimeoutBound(SessionReport report, Duration timeout) {
    Duration bound = timeout.plus(POLL).plus(DRAIN_SLACK);
    assertTrue(report.duration().compareTo(bound) < 0,
        "session took " + report.duration().toMillis() + " ms, bound " + bound.toMillis() + " ms");
  }
}
