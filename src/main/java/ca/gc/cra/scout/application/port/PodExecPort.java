package ca.gc.cra.scout.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs commands in pods and copies files out of them.
 *
 * <p>{@link #exec} is asynchronous: the returned future completes when the remote process exits.
 * Cancelling the future closes the exec channel, which terminates the remote command.</p>
 *
 * @since 0.1.0
 */
public interface PodExecPort {
  /**
   * Starts {@code command} in the first container of {@code pod}.
   *
   * @param namespace namespace of the pod
   * @param pod pod name
   * @param command argv of the command to execute
   * @return future completing with the command result, or exceptionally when the exec channel fails
   */
  CompletableFuture<CommandResult> exec(String namespace, String pod, List<String> command);

  /**
   * Copies a single file from the pod to the local filesystem.
   *
   * @param namespace namespace of the pod
   * @param pod pod name
   * @param remotePath absolute path inside the container
   * @param localFile destination file; parent directories are created
   * @throws IOException if the file does not exist or the copy fails
   */
  void copyFromPod(String namespace, String pod, String remotePath, Path localFile)
      throws IOException;
}
