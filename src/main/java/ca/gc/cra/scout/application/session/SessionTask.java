package ca.gc.cra.scout.application.session;

/**
 * Body of a task launched through {@link TaskGroup}.
 *
 * <p>Implementations return once {@code stop} is triggered (or their work is done) and must not
 * publish events after returning.</p>
 */
@FunctionalInterface
public interface SessionTask {
  void run(StopSignal stop) throws Exception;
}
