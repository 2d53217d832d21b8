package ca.gc.cra.scout.application.session;

import java.util.Objects;

/**
 * Raised when the cluster does not satisfy the session's preconditions. Nothing has been started
 * when this is thrown.
 *
 * @since 0.1.0
 */
public class PreflightException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why validation failed. */
  public enum Reason {
    NAMESPACE_NOT_FOUND,
    DEPLOYMENT_NOT_FOUND,
    DEPLOYMENT_AMBIGUOUS,
    DEPLOYMENT_NOT_READY
  }

  private final Reason reason;
  private final String namespace;
  private final String fragment;

  public PreflightException(Reason reason, String namespace, String fragment, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.namespace = namespace;
    this.fragment = fragment;
  }

  public Reason reason() {
    return reason;
  }

  public String namespace() {
    return namespace;
  }

  /**
   * Pod fragment that failed, or {@code null} for namespace failures.
   *
   * @return offending fragment
   */
  public String fragment() {
    return fragment;
  }
}
