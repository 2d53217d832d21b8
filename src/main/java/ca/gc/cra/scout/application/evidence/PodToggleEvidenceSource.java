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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evidence that is switched on in every target pod for the session's lifetime and switched off
 * again when the stop signal arrives.
 *
 * <p>Enable failures are per pod and non-fatal. Disable runs only for pods where enable
 * succeeded; any pod that cannot be disabled fails the task with an {@link EvidenceException},
 * which {@link #stop} reports.</p>
 */
public abstract class PodToggleEvidenceSource extends AbstractPodEvidenceSource {
  private static final Logger log = LoggerFactory.getLogger(PodToggleEvidenceSource.class);

  protected PodToggleEvidenceSource(
      ClusterPort cluster, PodExecPort exec, PodCommandSettings settings, MetricsPort metrics) {
    super(cluster, exec, settings, metrics);
  }

  @Override
  public EvidenceHandle start(CollectionSession session, TaskGroup tasks, WarningLog warnings) {
    CompletableFuture<Void> completion = new CompletableFuture<>();
    EvidenceHandle handle = new EvidenceHandle(name(), kind(), session.namespace(), completion);
    TaskHandle task = tasks.launch(name(), kind(), stop -> toggle(session, handle, warnings, stop));
    handle.bind(task);
    task.completion().whenComplete((ignored, error) -> completion.complete(null));
    return handle;
  }

  private void toggle(
      CollectionSession session, EvidenceHandle handle, WarningLog warnings, StopSignal stop)
      throws EvidenceException, InterruptedException {
    List<String> pods;
    try {
      pods = resolvePods(session.namespace(), session.podFragments());
    } catch (ClusterException ex) {
      recordEnableFailure(warnings, "unable to list pods: " + ex.getMessage());
      stop.await();
      return;
    }
    if (pods.isEmpty()) {
      recordEnableFailure(warnings, "no running pod matches " + session.podFragments());
      stop.await();
      return;
    }

    for (String pod : pods) {
      if (stop.isTriggered()) {
        break;
      }
      enable(session, handle, warnings, pod);
    }
    log.info("{} enabled in {} of {} pods", name(), handle.targets().size(), pods.size());

    boolean interrupted = false;
    try {
      stop.await();
    } catch (InterruptedException ex) {
      // still disable what was enabled; interrupt status restored below
      interrupted = true;
    }
    try {
      disableAll(session, handle);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void enable(CollectionSession session, EvidenceHandle handle, WarningLog warnings, String pod)
      throws InterruptedException {
    String command = expand(settings.startCommand(), session, pod);
    try {
      CommandResult result = runShell(session.namespace(), pod, command);
      if (result.success()) {
        handle.addTarget(pod, remoteArtifact(session, pod));
        log.debug("{} enabled in {}", name(), pod);
      } else {
        recordEnableFailure(warnings, "enable in " + pod + " exited " + result.exitCode());
      }
    } catch (EvidenceException ex) {
      recordEnableFailure(warnings, ex.getMessage());
    }
  }

  private void disableAll(CollectionSession session, EvidenceHandle handle) throws EvidenceException {
    if (!settings.hasStopCommand()) {
      return;
    }
    List<String> failed = new ArrayList<>();
    for (String pod : handle.targets()) {
      String command = expand(settings.stopCommand(), session, pod);
      try {
        CommandResult result = runShell(session.namespace(), pod, command);
        if (!result.success()) {
          failed.add(pod + " (exit " + result.exitCode() + ")");
        }
      } catch (EvidenceException ex) {
        failed.add(pod + " (" + ex.getMessage() + ")");
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        failed.add(pod + " (interrupted)");
        break;
      }
    }
    if (!failed.isEmpty()) {
      throw new EvidenceException(name() + " could not be disabled in " + String.join(", ", failed));
    }
    log.info("{} disabled in {} pods", name(), handle.targets().size());
  }
}
