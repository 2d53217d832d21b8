package ca.gc.cra.scout.domain.session;

/**
 * <strong>What:</strong> Lifecycle states of a symptom collection session.
 * <p><strong>Why:</strong> Gives the orchestrator, logs and the final report one vocabulary for
 * where a session stopped.</p>
 * <p>Normal progression is {@code CREATED -> VALIDATING -> COLLECTING -> EXERCISING -> DRAINING ->
 * CLOSED}. {@link #VALIDATION_FAILED} is terminal and reachable only from {@link #VALIDATING}.</p>
 *
 * @since 0.1.0
 */
public enum SessionState {
  /** Session object built; nothing has touched the cluster. */
  CREATED,
  /** Preflight checks are running against the cluster. */
  VALIDATING,
  /** Trace, capture and log watcher tasks are running. */
  COLLECTING,
  /** Exerciser is running; waiting for its completion or the session timeout. */
  EXERCISING,
  /** Stop broadcast sent; waiting for every task to acknowledge. */
  DRAINING,
  /** Artifacts consolidated and report produced. */
  CLOSED,
  /** Preflight failed; no task was started. */
  VALIDATION_FAILED;

  /**
   * Indicates whether the state ends the session.
   *
   * @return {@code true} for {@link #CLOSED} and {@link #VALIDATION_FAILED}
   */
  public boolean terminal() {
    return this == CLOSED || this == VALIDATION_FAILED;
  }
}
