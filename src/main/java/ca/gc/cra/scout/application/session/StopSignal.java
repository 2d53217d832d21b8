package ca.gc.cra.scout.application.session;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot broadcast telling every session task to wind down.
 *
 * <p>Triggering is idempotent; the first reason wins. Tasks either poll {@link #isTriggered()},
 * block in {@link #await(Duration)} as their cancellable timer, or attach callbacks through
 * {@link #whenTriggered()}.</p>
 *
 * @since 0.1.0
 */
public final class StopSignal {
  private final AtomicBoolean triggered = new AtomicBoolean();
  private final CountDownLatch latch = new CountDownLatch(1);
  private final CompletableFuture<Void> future = new CompletableFuture<>();
  private volatile String reason = "";

  /**
   * Broadcasts the stop request.
   *
   * @param reason short description recorded for diagnostics
   * @return {@code true} if this call triggered the signal, {@code false} if it was already set
   */
  public boolean trigger(String reason) {
    if (!triggered.compareAndSet(false, true)) {
      return false;
    }
    this.reason = reason == null ? "" : reason;
    latch.countDown();
    future.complete(null);
    return true;
  }

  public boolean isTriggered() {
    return latch.getCount() == 0;
  }

  public String reason() {
    return reason;
  }

  /**
   * Waits up to {@code timeout} for the signal.
   *
   * @param timeout maximum wait
   * @return {@code true} if the signal was triggered before the wait elapsed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Waits without bound for the signal.
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void await() throws InterruptedException {
    latch.await();
  }

  /**
   * Stage completing when the signal is triggered; callbacks run on the triggering thread.
   *
   * @return completion stage view of the signal
   */
  public CompletionStage<Void> whenTriggered() {
    return future.minimalCompletionStage();
  }
}
