package ca.gc.cra.scout.application.port;

/**
 * Outcome of a command executed inside a pod.
 *
 * @param exitCode process exit status; {@code -1} when the exec channel closed without one
 * @param stdout captured standard output
 * @param stderr captured standard error
 */
public record CommandResult(int exitCode, String stdout, String stderr) {
  public CommandResult {
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }

  public boolean success() {
    return exitCode == 0;
  }
}
