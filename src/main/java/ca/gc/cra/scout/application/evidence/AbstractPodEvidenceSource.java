package ca.gc.cra.scout.application.evidence;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.port.CommandResult;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.application.port.PodExecPort;
import ca.gc.cra.scout.application.session.WarningLog;
import ca.gc.cra.scout.domain.cluster.PodInfo;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.domain.session.WarningKind;
import ca.gc.cra.scout.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for evidence sources that act through pod exec: target resolution, bounded
 * command execution, stop handling and artifact copy.
 */
abstract class AbstractPodEvidenceSource implements EvidenceSource {
  private static final Logger log = LoggerFactory.getLogger(AbstractPodEvidenceSource.class);
  private static final int OUTPUT_LOG_BYTES = 256;

  protected final ClusterPort cluster;
  protected final PodExecPort exec;
  protected final PodCommandSettings settings;
  protected final MetricsPort metrics;

  AbstractPodEvidenceSource(
      ClusterPort cluster, PodExecPort exec, PodCommandSettings settings, MetricsPort metrics) {
    this.cluster = Objects.requireNonNull(cluster, "cluster");
    this.exec = Objects.requireNonNull(exec, "exec");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  public PodCommandSettings settings() {
    return settings;
  }

  /** Subdirectory of the session output receiving this source's artifacts. */
  protected abstract String artifactDirectory();

  /**
   * Running pods whose names contain any of {@code fragments}, in fragment then API order.
   */
  protected List<String> resolvePods(String namespace, List<String> fragments) throws ClusterException {
    List<PodInfo> pods = cluster.listPods(namespace);
    Set<String> selected = new LinkedHashSet<>();
    for (String fragment : fragments) {
      for (PodInfo pod : pods) {
        if (pod.running() && pod.name().contains(fragment)) {
          selected.add(pod.name());
        }
      }
    }
    return new ArrayList<>(selected);
  }

  /**
   * Runs {@code command} through {@code sh -c} and waits up to the configured command timeout.
   *
   * @return the command result
   * @throws EvidenceException if the exec channel fails or the command times out
   * @throws InterruptedException if interrupted while waiting
   */
  protected CommandResult runShell(String namespace, String pod, String command)
      throws EvidenceException, InterruptedException {
    return await(exec.exec(namespace, pod, shell(command)), settings.commandTimeout(), pod);
  }

  protected CommandResult await(CompletableFuture<CommandResult> pending, Duration timeout, String pod)
      throws EvidenceException, InterruptedException {
    try {
      CommandResult result = pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      if (!result.success()) {
        log.debug("{} command in {} exited {}: {}", name(), pod, result.exitCode(),
            Logs.truncate(result.stderr(), OUTPUT_LOG_BYTES));
      }
      return result;
    } catch (TimeoutException ex) {
      pending.cancel(true);
      throw new EvidenceException(
          name() + " command in " + pod + " timed out after " + timeout.toMillis() + " ms");
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new EvidenceException(name() + " command in " + pod + " failed: " + cause.getMessage(), cause);
    } catch (InterruptedException ex) {
      pending.cancel(true);
      throw ex;
    }
  }

  static List<String> shell(String command) {
    return List.of("sh", "-c", command);
  }

  /** Replaces {@code {session}} and {@code {pod}} placeholders. */
  static String expand(String template, CollectionSession session, String pod) {
    return template.replace("{session}", session.sessionId()).replace("{pod}", pod);
  }

  @Override
  public void stop(EvidenceHandle handle) throws EvidenceException, InterruptedException {
    Objects.requireNonNull(handle, "handle");
    if (handle.task() == null) {
      return;
    }
    if (!handle.task().awaitStopped(settings.stopTimeout())) {
      throw new EvidenceException(
          name() + " did not stop within " + settings.stopTimeout().toMillis() + " ms");
    }
    Throwable failure = handle.task().failure().orElse(null);
    if (failure instanceof EvidenceException evidence) {
      throw evidence;
    }
    if (failure != null) {
      throw new EvidenceException(name() + " failed: " + failure.getMessage(), failure);
    }
  }

  @Override
  public List<Path> consolidate(EvidenceHandle handle, Path outputDirectory, WarningLog warnings) {
    List<Path> written = new ArrayList<>();
    for (Map.Entry<String, String> artifact : handle.artifacts()) {
      String pod = artifact.getKey();
      String remote = artifact.getValue();
      Path local = outputDirectory.resolve(artifactDirectory()).resolve(pod).resolve(fileName(remote));
      try {
        exec.copyFromPod(handle.namespace(), pod, remote, local);
        written.add(local);
        log.info("Copied {} artifact {}:{} to {}", name(), pod, remote, local);
      } catch (IOException ex) {
        metrics.increment("evidence.copy.failed");
        warnings.record(WarningKind.PARTIAL_COLLECTION, name(),
            "could not copy " + remote + " from " + pod + ": " + ex.getMessage());
      }
    }
    return written;
  }

  private static String fileName(String remote) {
    int idx = remote.lastIndexOf('/');
    String name = idx >= 0 ? remote.substring(idx + 1) : remote;
    return name.isBlank() ? "artifact" : name;
  }

  /** Remote artifact path for {@code pod}, or {@code null} when the source copies nothing. */
  protected String remoteArtifact(CollectionSession session, String pod) {
    return settings.hasArtifact() ? expand(settings.artifactPath(), session, pod) : null;
  }

  protected void recordEnableFailure(WarningLog warnings, String message) {
    metrics.increment("evidence.enable.failed");
    warnings.record(WarningKind.SOURCE_ENABLE, name(), message);
  }
}
