package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.domain.session.TaskKind;
import ca.gc.cra.scout.domain.session.TaskState;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observable state of one launched task.
 *
 * <p>State only moves forward: {@code STARTING -> RUNNING -> STOPPING -> STOPPED}. The completion
 * future completes normally when the task reaches {@code STOPPED}, whether or not it failed; use
 * {@link #failure()} to inspect the outcome.</p>
 *
 * @since 0.1.0
 */
public final class TaskHandle {
  private final String name;
  private final TaskKind kind;
  private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.STARTING);
  private final CompletableFuture<Void> stopped = new CompletableFuture<>();
  private volatile Throwable failure;

  TaskHandle(String name, TaskKind kind) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public String name() {
    return name;
  }

  public TaskKind kind() {
    return kind;
  }

  public TaskState state() {
    return state.get();
  }

  public boolean isStopped() {
    return state.get() == TaskState.STOPPED;
  }

  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Future that completes once the task has stopped.
   *
   * @return read-only completion stage of the task
   */
  public CompletableFuture<Void> completion() {
    return stopped.copy();
  }

  /**
   * Waits up to {@code timeout} for the task to stop.
   *
   * @param timeout maximum wait
   * @return {@code true} if the task stopped in time
   * @throws InterruptedException if the caller is interrupted
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    try {
      stopped.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException ex) {
      return false;
    } catch (ExecutionException ex) {
      // completion future is only ever completed normally
      return true;
    }
  }

  void markRunning() {
    state.compareAndSet(TaskState.STARTING, TaskState.RUNNING);
  }

  void markStopping() {
    state.getAndUpdate(current ->
        current == TaskState.STARTING || current == TaskState.RUNNING ? TaskState.STOPPING : current);
  }

  void markStopped(Throwable cause) {
    this.failure = cause;
    state.set(TaskState.STOPPED);
    stopped.complete(null);
  }

  @Override
  public String toString() {
    return "TaskHandle{" + kind + ":" + name + ", state=" + state.get() + '}';
  }
}
