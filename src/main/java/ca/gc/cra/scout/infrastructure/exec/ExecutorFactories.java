package ca.gc.cra.scout.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named executors a collection session runs on.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds an executor that gives every session task its own thread.
   *
   * <p>Session tasks block for the whole session (watchers wait on the stop signal, evidence
   * sources wait on remote commands), so the pool grows with the number of launched tasks and
   * idle threads are reclaimed after a minute.</p>
   *
   * @param prefix thread-name prefix used to tag task threads
   * @param handler uncaught exception handler installed on each thread
   * @return configured executor service
   */
  public static ExecutorService newTaskPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedFactory(prefix, "scout-task", handler);
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-thread executor for a dedicated consumer loop.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return configured executor service
   */
  public static ExecutorService newSingleWorker(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedFactory(prefix, "scout-worker", handler);
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  private static ThreadFactory namedFactory(
      String prefix, String fallbackPrefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
