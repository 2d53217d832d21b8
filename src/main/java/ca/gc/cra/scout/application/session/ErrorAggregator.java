package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.application.port.ErrorEventSink;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.domain.events.ErrorEvent;
import ca.gc.cra.scout.infrastructure.exec.ExecutorFactories;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fan-in of error events from every log watcher into one ordered stream.
 * <p><strong>Why:</strong> Sinks see events one at a time, in arrival order, from a single thread.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Buffer at most {@code capacity} events; producers block when the buffer is full so nothing
 *   is dropped.</li>
 *   <li>Forward each event to every sink on the consumer thread; a failing sink is logged and
 *   skipped.</li>
 *   <li>Close exactly once, after which publishing is an error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #publish(ErrorEvent)} is safe from any number of
 * producer threads. {@link #close()} must only be called after every producer has stopped.</p>
 *
 * @since 0.1.0
 */
public final class ErrorAggregator {
  private static final Logger log = LoggerFactory.getLogger(ErrorAggregator.class);
  private static final ErrorEvent END_OF_STREAM = new ErrorEvent(Instant.EPOCH, "", "");
  private static final long CLOSE_JOIN_SECONDS = 30L;

  private final BlockingQueue<ErrorEvent> queue;
  private final List<ErrorEventSink> sinks;
  private final MetricsPort metrics;
  private final String threadPrefix;
  private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong published = new AtomicLong();
  private ExecutorService consumer;
  private boolean closed;

  public ErrorAggregator(int capacity, List<ErrorEventSink> sinks, MetricsPort metrics, String threadPrefix) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.threadPrefix = threadPrefix == null ? "scout-aggregator" : threadPrefix;
  }

  /**
   * Starts the consumer thread. Events published before start are buffered.
   *
   * @throws IllegalStateException if already started or closed
   */
  public void start() {
    lifecycle.writeLock().lock();
    try {
      if (closed) {
        throw new IllegalStateException("aggregator already closed");
      }
      if (consumer != null) {
        throw new IllegalStateException("aggregator already started");
      }
      consumer = ExecutorFactories.newSingleWorker(threadPrefix,
          (t, ex) -> log.error("Aggregator consumer {} terminated unexpectedly", t.getName(), ex));
      consumer.execute(this::drain);
    } finally {
      lifecycle.writeLock().unlock();
    }
  }

  /**
   * Enqueues an event, blocking while the buffer is full.
   *
   * @param event event to forward
   * @throws InterruptedException if the producer is interrupted while waiting for space
   * @throws IllegalStateException if the aggregator has been closed
   */
  public void publish(ErrorEvent event) throws InterruptedException {
    Objects.requireNonNull(event, "event");
    lifecycle.readLock().lock();
    try {
      if (closed) {
        throw new IllegalStateException("aggregator closed; event from " + event.source() + " rejected");
      }
      if (!queue.offer(event)) {
        metrics.increment("aggregator.backpressure");
        long startNanos = System.nanoTime();
        queue.put(event);
        metrics.observe("aggregator.publish.wait.nanos", System.nanoTime() - startNanos);
      }
      published.incrementAndGet();
    } finally {
      lifecycle.readLock().unlock();
    }
  }

  /**
   * Drains remaining events, stops the consumer and closes every sink.
   *
   * @throws IllegalStateException if called more than once
   * @throws InterruptedException if interrupted while waiting for the consumer to finish
   */
  public void close() throws InterruptedException {
    ExecutorService running;
    lifecycle.writeLock().lock();
    try {
      if (closed) {
        throw new IllegalStateException("aggregator already closed");
      }
      closed = true;
      running = consumer;
    } finally {
      lifecycle.writeLock().unlock();
    }

    if (running == null) {
      // never started: deliver what was buffered on the caller's thread
      drainRemaining();
    } else {
      queue.put(END_OF_STREAM);
      running.shutdown();
      if (!running.awaitTermination(CLOSE_JOIN_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Aggregator consumer did not finish within {}s; {} events undelivered",
            CLOSE_JOIN_SECONDS, queue.size());
        running.shutdownNow();
      }
    }
    closeSinks();
    log.debug("Aggregator closed after delivering {} of {} events", delivered.get(), published.get());
  }

  private void drain() {
    while (true) {
      ErrorEvent event;
      try {
        event = queue.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Aggregator consumer interrupted with {} events pending", queue.size());
        return;
      }
      if (event == END_OF_STREAM) {
        return;
      }
      dispatch(event);
    }
  }

  private void drainRemaining() {
    ErrorEvent event;
    while ((event = queue.poll()) != null) {
      dispatch(event);
    }
  }

  private void dispatch(ErrorEvent event) {
    delivered.incrementAndGet();
    metrics.increment("aggregator.events");
    for (ErrorEventSink sink : sinks) {
      try {
        sink.accept(event);
      } catch (RuntimeException ex) {
        metrics.increment("aggregator.sink.failed");
        log.warn("Error event sink {} rejected event from {}", sink.getClass().getSimpleName(), event.source(), ex);
      }
    }
  }

  private void closeSinks() {
    for (ErrorEventSink sink : sinks) {
      try {
        sink.close();
      } catch (Exception ex) {
        log.warn("Failed to close error event sink {}", sink.getClass().getSimpleName(), ex);
      }
    }
  }

  public boolean isClosed() {
    lifecycle.readLock().lock();
    try {
      return closed;
    } finally {
      lifecycle.readLock().unlock();
    }
  }

  public long deliveredCount() {
    return delivered.get();
  }

  public long publishedCount() {
    return published.get();
  }
}
