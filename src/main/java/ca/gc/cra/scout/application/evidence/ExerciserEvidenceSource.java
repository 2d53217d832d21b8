package ca.gc.cra.scout.application.evidence;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.port.CommandResult;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.application.port.PodExecPort;
import ca.gc.cra.scout.application.session.StopSignal;
import ca.gc.cra.scout.application.session.TaskGroup;
import ca.gc.cra.scout.application.session.TaskHandle;
import ca.gc.cra.scout.application.session.WarningLog;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.domain.session.TaskKind;
import ca.gc.cra.scout.logging.Logs;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the workload-exercising test suite in the test-client pod.
 *
 * <p>{@link EvidenceHandle#completion()} completes normally when the test command exits with
 * status zero and exceptionally with an {@link EvidenceException} when it fails or is cancelled by
 * the stop signal. When the test-client pod cannot be resolved the command never runs and the
 * completion carries an {@link EvidenceUnavailableException}. The command itself is not time-boxed here; the
 * orchestrator's session timeout bounds it.</p>
 */
public final class ExerciserEvidenceSource extends AbstractPodEvidenceSource {
  private static final Logger log = LoggerFactory.getLogger(ExerciserEvidenceSource.class);
  private static final int STDERR_LOG_BYTES = 512;

  private final String podFragment;

  public ExerciserEvidenceSource(
      ClusterPort cluster,
      PodExecPort exec,
      String podFragment,
      PodCommandSettings settings,
      MetricsPort metrics) {
    super(cluster, exec, settings, metrics);
    this.podFragment = Objects.requireNonNull(podFragment, "podFragment");
    if (podFragment.isBlank()) {
      throw new IllegalArgumentException("exerciser pod fragment must not be blank");
    }
  }

  @Override
  public String name() {
    return "exerciser";
  }

  @Override
  public TaskKind kind() {
    return TaskKind.EXERCISER;
  }

  @Override
  protected String artifactDirectory() {
    return "exerciser";
  }

  @Override
  public EvidenceHandle start(CollectionSession session, TaskGroup tasks, WarningLog warnings) {
    CompletableFuture<Void> completion = new CompletableFuture<>();
    EvidenceHandle handle = new EvidenceHandle(name(), kind(), session.namespace(), completion);
    TaskHandle task = tasks.launch(name(), kind(), stop -> {
      try {
        exercise(session, handle, completion, warnings, stop);
      } finally {
        if (!completion.isDone()) {
          completion.completeExceptionally(new EvidenceException("exerciser ended without a result"));
        }
      }
    });
    handle.bind(task);
    return handle;
  }

  private void exercise(
      CollectionSession session,
      EvidenceHandle handle,
      CompletableFuture<Void> completion,
      WarningLog warnings,
      StopSignal stop)
      throws InterruptedException {
    String pod;
    try {
      List<String> pods = resolvePods(session.namespace(), List.of(podFragment));
      if (pods.isEmpty()) {
        recordEnableFailure(warnings, "no running pod matches '" + podFragment + "'");
        completion.completeExceptionally(
            new EvidenceUnavailableException("no running pod matches '" + podFragment + "'"));
        return;
      }
      pod = pods.get(0);
    } catch (ClusterException ex) {
      recordEnableFailure(warnings, "unable to list pods: " + ex.getMessage());
      completion.completeExceptionally(
          new EvidenceUnavailableException("unable to resolve exerciser pod", ex));
      return;
    }

    handle.addTarget(pod, remoteArtifact(session, pod));
    String command = expand(settings.startCommand(), session, pod);
    log.info("Running exerciser in {}", pod);
    CompletableFuture<CommandResult> running = exec.exec(session.namespace(), pod, shell(command));
    stop.whenTriggered().thenRun(() -> running.cancel(true));
    try {
      CommandResult result = running.get();
      if (result.success()) {
        log.info("Exerciser in {} completed", pod);
        completion.complete(null);
      } else {
        log.warn("Exerciser in {} exited {}: {}", pod, result.exitCode(),
            Logs.truncate(result.stderr(), STDERR_LOG_BYTES));
        completion.completeExceptionally(
            new EvidenceException("exerciser exited with status " + result.exitCode()));
      }
    } catch (CancellationException ex) {
      completion.completeExceptionally(new EvidenceException("exerciser cancelled: " + stop.reason()));
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      completion.completeExceptionally(
          new EvidenceException("exerciser could not run: " + cause.getMessage(), cause));
    } catch (InterruptedException ex) {
      running.cancel(true);
      throw ex;
    }
  }

  public String podFragment() {
    return podFragment;
  }
}
