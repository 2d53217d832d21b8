package ca.gc.cra.scout.application.evidence;

import ca.gc.cra.scout.application.session.TaskGroup;
import ca.gc.cra.scout.application.session.WarningLog;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.domain.session.TaskKind;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Something that produces diagnostic evidence while a session runs
 * (process traces, packet captures, the exercising test run).
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>{@link #start} launches the work as a task in the session's {@link TaskGroup} and returns
 *   at once. Failures to enable are recorded in the {@link WarningLog} and never abort the
 *   session.</li>
 *   <li>The task must finish once the group's stop signal is triggered.</li>
 *   <li>{@link #stop} waits, bounded, for that task and reports cleanup failures.</li>
 *   <li>{@link #consolidate} copies produced artifacts into the session output directory after
 *   every task has stopped.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface EvidenceSource {
  String name();

  TaskKind kind();

  /**
   * Launches the source's task.
   *
   * @param session running session
   * @param tasks join barrier receiving the task
   * @param warnings sink for non-fatal problems
   * @return handle used for stop and consolidation
   */
  EvidenceHandle start(CollectionSession session, TaskGroup tasks, WarningLog warnings);

  /**
   * Waits for the source's task after the stop signal and surfaces cleanup failures.
   *
   * @param handle handle returned by {@link #start}
   * @throws EvidenceException if the task did not stop in time or failed to clean up
   * @throws InterruptedException if interrupted while waiting
   */
  void stop(EvidenceHandle handle) throws EvidenceException, InterruptedException;

  /**
   * Copies artifacts into {@code outputDirectory}.
   *
   * @param handle handle returned by {@link #start}
   * @param outputDirectory session output directory
   * @param warnings sink for artifacts that could not be copied
   * @return files written
   */
  List<Path> consolidate(EvidenceHandle handle, Path outputDirectory, WarningLog warnings);
}
