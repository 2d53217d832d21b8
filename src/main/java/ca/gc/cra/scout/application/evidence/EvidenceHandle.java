package ca.gc.cra.scout.application.evidence;

import ca.gc.cra.scout.application.session.TaskHandle;
import ca.gc.cra.scout.domain.session.TaskKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handle returned by {@link EvidenceSource#start}.
 *
 * <p>Tracks the launched task, the pods the source acted on, and a completion future. For the
 * exerciser the completion future reports the test outcome; for toggled sources it completes
 * when the task stops.</p>
 *
 * @since 0.1.0
 */
public final class EvidenceHandle {
  private final String source;
  private final TaskKind kind;
  private final String namespace;
  private final CompletableFuture<Void> completion;
  private final List<String> targets = new CopyOnWriteArrayList<>();
  private final Map<String, String> remoteArtifacts = new ConcurrentHashMap<>();
  private volatile TaskHandle task;

  EvidenceHandle(String source, TaskKind kind, String namespace, CompletableFuture<Void> completion) {
    this.source = Objects.requireNonNull(source, "source");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.completion = Objects.requireNonNull(completion, "completion");
  }

  void bind(TaskHandle task) {
    this.task = Objects.requireNonNull(task, "task");
  }

  void addTarget(String pod, String remoteArtifact) {
    targets.add(pod);
    if (remoteArtifact != null && !remoteArtifact.isBlank()) {
      remoteArtifacts.put(pod, remoteArtifact);
    }
  }

  public String source() {
    return source;
  }

  public TaskKind kind() {
    return kind;
  }

  public String namespace() {
    return namespace;
  }

  public TaskHandle task() {
    return task;
  }

  /**
   * Pods on which the source's action succeeded.
   *
   * @return snapshot of target pod names
   */
  public List<String> targets() {
    return List.copyOf(targets);
  }

  /**
   * Remote artifact paths keyed by target pod, in target order.
   *
   * @return pods with an artifact to copy
   */
  public List<Map.Entry<String, String>> artifacts() {
    List<Map.Entry<String, String>> result = new ArrayList<>();
    for (String pod : targets) {
      String remote = remoteArtifacts.get(pod);
      if (remote != null) {
        result.add(Map.entry(pod, remote));
      }
    }
    return result;
  }

  public CompletableFuture<Void> completion() {
    return completion;
  }
}
