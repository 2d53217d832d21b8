package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.domain.session.TaskKind;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Join barrier for every task of one session.
 * <p><strong>Why:</strong> The aggregator may only close once every producer has stopped; a
 * {@link Phaser} used as a wait-group makes that an explicit join instead of a sleep.</p>
 * <p><strong>Thread-safety:</strong> {@link #launch} may be called from any thread until
 * {@link #awaitAll(Duration)} is first invoked; later launches are rejected.</p>
 *
 * @since 0.1.0
 */
public final class TaskGroup {
  private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);
  static final String MDC_SESSION = "session";

  private final String sessionId;
  private final Executor executor;
  private final StopSignal stop;
  // the orchestrator holds the initial party until it joins
  private final Phaser phaser = new Phaser(1);
  private final List<TaskHandle> handles = new CopyOnWriteArrayList<>();
  private final AtomicInteger started = new AtomicInteger();
  private final AtomicInteger stopped = new AtomicInteger();
  private boolean joined;
  private int joinPhase;

  public TaskGroup(String sessionId, Executor executor, StopSignal stop) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.stop = Objects.requireNonNull(stop, "stop");
    stop.whenTriggered().thenRun(() -> handles.forEach(TaskHandle::markStopping));
  }

  /**
   * Registers and starts a task.
   *
   * @param name task name used in logs and the thread's MDC
   * @param kind task kind
   * @param task task body
   * @return handle tracking the task
   * @throws IllegalStateException if the group has already been joined
   * @throws RejectedExecutionException if the executor refuses the task
   */
  public TaskHandle launch(String name, TaskKind kind, SessionTask task) {
    Objects.requireNonNull(task, "task");
    TaskHandle handle = new TaskHandle(name, kind);
    synchronized (this) {
      if (joined) {
        throw new IllegalStateException("task group already joined; cannot launch " + name);
      }
      phaser.register();
      handles.add(handle);
      started.incrementAndGet();
    }
    try {
      executor.execute(() -> runTask(handle, task));
    } catch (RejectedExecutionException ex) {
      finish(handle, ex);
      throw ex;
    }
    if (stop.isTriggered()) {
      handle.markStopping();
    }
    log.debug("Launched {} task {}", kind, name);
    return handle;
  }

  private void runTask(TaskHandle handle, SessionTask task) {
    MDC.put(MDC_SESSION, sessionId);
    Throwable failure = null;
    handle.markRunning();
    try {
      task.run(stop);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      failure = ex;
      log.warn("Task {} interrupted", handle.name());
    } catch (Exception ex) {
      failure = ex;
      log.warn("Task {} failed: {}", handle.name(), ex.getMessage(), ex);
    } finally {
      finish(handle, failure);
      MDC.remove(MDC_SESSION);
    }
  }

  private void finish(TaskHandle handle, Throwable failure) {
    handle.markStopped(failure);
    stopped.incrementAndGet();
    phaser.arriveAndDeregister();
  }

  /**
   * Blocks until every launched task has stopped or {@code timeout} elapses. The first call closes
   * the group to further launches.
   *
   * @param timeout maximum wait
   * @return {@code true} when every task stopped
   * @throws InterruptedException if the caller is interrupted
   */
  public boolean awaitAll(Duration timeout) throws InterruptedException {
    int phase;
    synchronized (this) {
      if (!joined) {
        joined = true;
        joinPhase = phaser.arrive();
      }
      phase = joinPhase;
    }
    try {
      phaser.awaitAdvanceInterruptibly(phase, timeout.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException ex) {
      return false;
    }
  }

  public int startedCount() {
    return started.get();
  }

  public int stoppedCount() {
    return stopped.get();
  }

  public List<TaskHandle> handles() {
    return List.copyOf(handles);
  }

  public StopSignal stopSignal() {
    return stop;
  }
}
