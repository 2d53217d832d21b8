package ca.gc.cra.scout.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by scout commands.
 * <p><strong>Why:</strong> Automation wrapping scout distinguishes "the cluster was not in a state to
 * collect" from argument, configuration and I/O problems.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Session closed (warnings included) or command succeeded. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure, including an unreachable cluster. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Preflight validation rejected the namespace or a deployment; nothing was started. */
  VALIDATION_FAILED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
