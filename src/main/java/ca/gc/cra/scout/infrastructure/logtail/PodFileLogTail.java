package ca.gc.cra.scout.infrastructure.logtail;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.port.CommandResult;
import ca.gc.cra.scout.application.port.LogTailPort;
import ca.gc.cra.scout.application.port.PodExecPort;
import ca.gc.cra.scout.domain.cluster.PodInfo;
import ca.gc.cra.scout.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LogTailPort} that reads monitored paths inside a workload pod through exec.
 *
 * <p>The pod is the first running pod whose name contains the configured fragment; it is resolved
 * on first use and re-resolved after an exec failure, so a restarted pod is picked up on a later
 * poll. File chunks are transferred base64 encoded so byte offsets stay exact.</p>
 */
public final class PodFileLogTail implements LogTailPort {
  private static final Logger log = LoggerFactory.getLogger(PodFileLogTail.class);
  private static final int STDERR_LOG_BYTES = 256;

  private final ClusterPort cluster;
  private final PodExecPort exec;
  private final String namespace;
  private final String podFragment;
  private final Duration commandTimeout;
  private volatile String pod;

  public PodFileLogTail(
      ClusterPort cluster,
      PodExecPort exec,
      String namespace,
      String podFragment,
      Duration commandTimeout) {
    this.cluster = Objects.requireNonNull(cluster, "cluster");
    this.exec = Objects.requireNonNull(exec, "exec");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.podFragment = Objects.requireNonNull(podFragment, "podFragment");
    this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
  }

  @Override
  public PathStatus stat(String path) throws IOException {
    String q = quote(path);
    String script = "if [ -d " + q + " ]; then echo D; "
        + "elif [ -f " + q + " ]; then echo F $(wc -c < " + q + "); "
        + "elif [ -e " + q + " ]; then echo O; else echo M; fi";
    String[] out = run(script).stdout().trim().split("\\s+");
    switch (out[0]) {
      case "D":
        return PathStatus.directory();
      case "F":
        if (out.length < 2) {
          throw new IOException("unexpected stat output for " + path);
        }
        try {
          return PathStatus.file(Long.parseLong(out[1]));
        } catch (NumberFormatException ex) {
          throw new IOException("unexpected size for " + path + ": " + out[1], ex);
        }
      case "M":
        return PathStatus.missing();
      default:
        throw new IOException(path + " is neither a regular file nor a directory");
    }
  }

  @Override
  public byte[] read(String path, long offset, int maxBytes) throws IOException {
    String script = "tail -c +" + (offset + 1) + " " + quote(path) + " | head -c " + maxBytes + " | base64";
    String encoded = run(script).stdout();
    try {
      return Base64.getMimeDecoder().decode(encoded);
    } catch (IllegalArgumentException ex) {
      throw new IOException("malformed chunk read from " + path, ex);
    }
  }

  @Override
  public List<String> list(String directory) throws IOException {
    List<String> names = new ArrayList<>();
    for (String line : run("ls -1A " + quote(directory)).stdout().split("\n")) {
      if (!line.isBlank()) {
        names.add(line.strip());
      }
    }
    return names;
  }

  private CommandResult run(String script) throws IOException {
    String target = resolvePod();
    CompletableFuture<CommandResult> future = exec.exec(namespace, target, List.of("sh", "-c", script));
    CommandResult result;
    try {
      result = future.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted reading from " + target);
    } catch (TimeoutException ex) {
      future.cancel(true);
      pod = null;
      throw new IOException("command in " + target + " timed out after " + commandTimeout);
    } catch (ExecutionException ex) {
      pod = null;
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      throw new IOException("exec in " + target + " failed: " + cause.getMessage(), cause);
    }
    if (!result.success()) {
      throw new IOException("command in " + target + " exited " + result.exitCode() + ": "
          + Logs.truncate(Logs.singleLine(result.stderr()), STDERR_LOG_BYTES));
    }
    return result;
  }

  private String resolvePod() throws IOException {
    String current = pod;
    if (current != null) {
      return current;
    }
    List<PodInfo> pods;
    try {
      pods = cluster.listPods(namespace);
    } catch (ClusterException ex) {
      throw new IOException("unable to list pods in " + namespace, ex);
    }
    for (PodInfo info : pods) {
      if (info.running() && info.name().contains(podFragment)) {
        log.debug("Watching log paths in pod {}", info.name());
        pod = info.name();
        return info.name();
      }
    }
    throw new IOException("no running pod matches '" + podFragment + "' in " + namespace);
  }

  static String quote(String value) {
    return "'" + value.replace("'", "'\\''") + "'";
  }
}
