package ca.gc.cra.scout.domain.session;

/** Per-task lifecycle; transitions only move forward. */
public enum TaskState {
  STARTING,
  RUNNING,
  STOPPING,
  STOPPED
}
