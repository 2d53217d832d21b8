package ca.gc.cra.scout.domain.session;

/**
 * Categories of non-fatal problems recorded during a session.
 *
 * @since 0.1.0
 */
public enum WarningKind {
  /** An evidence source could not be enabled in one or more pods. */
  SOURCE_ENABLE,
  /** A monitored path was missing or unreadable during a poll. */
  WATCH,
  /** A task failed to stop cleanly or an artifact could not be collected. */
  PARTIAL_COLLECTION,
  /** The exerciser did not complete before the session timeout. */
  TIMEOUT_EXCEEDED,
  /** The exerciser finished with a failure. */
  EXERCISER_FAILED
}
