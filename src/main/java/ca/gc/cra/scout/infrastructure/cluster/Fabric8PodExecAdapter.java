package ca.gc.cra.scout.infrastructure.cluster;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.CommandResult;
import ca.gc.cra.scout.application.port.PodExecPort;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PodExecPort} backed by the fabric8 exec and file-copy APIs.
 *
 * <p>The exec channel is closed when the returned future completes, including when a caller
 * cancels it; closing the channel terminates the remote process.</p>
 */
public final class Fabric8PodExecAdapter implements PodExecPort {
  private static final Logger log = LoggerFactory.getLogger(Fabric8PodExecAdapter.class);

  private final KubernetesClient client;

  public Fabric8PodExecAdapter(KubernetesClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public CompletableFuture<CommandResult> exec(String namespace, String pod, List<String> command) {
    ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    ExecWatch watch;
    try {
      watch = client.pods()
          .inNamespace(namespace)
          .withName(pod)
          .writingOutput(stdout)
          .writingError(stderr)
          .exec(command.toArray(String[]::new));
    } catch (KubernetesClientException ex) {
      return CompletableFuture.failedFuture(
          new ClusterException("exec in " + namespace + "/" + pod + " failed: " + ex.getMessage(), ex));
    }
    log.debug("exec {}/{}: {}", namespace, pod, command);
    CompletableFuture<CommandResult> result = watch.exitCode().thenApply(code -> new CommandResult(
        code == null ? -1 : code,
        stdout.toString(StandardCharsets.UTF_8),
        stderr.toString(StandardCharsets.UTF_8)));
    result.whenComplete((ignored, error) -> watch.close());
    return result;
  }

  @Override
  public void copyFromPod(String namespace, String pod, String remotePath, Path localFile)
      throws IOException {
    Path parent = localFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    boolean copied;
    try {
      copied = client.pods().inNamespace(namespace).withName(pod).file(remotePath).copy(localFile);
    } catch (KubernetesClientException ex) {
      throw new ClusterException("copy of " + pod + ":" + remotePath + " failed: " + ex.getMessage(), ex);
    }
    if (!copied || !Files.exists(localFile)) {
      throw new IOException(pod + ":" + remotePath + " could not be copied");
    }
  }
}
