package ca.gc.cra.scout.domain.session;

/** Kinds of concurrent work a session runs. */
public enum TaskKind {
  TRACE,
  CAPTURE,
  EXERCISER,
  LOG_WATCHER
}
