package ca.gc.cra.scout.application.evidence;

import java.time.Duration;
import java.util.Objects;

/**
 * Shell commands and artifact location for an evidence source that runs inside pods.
 *
 * @param enabled whether the source participates in sessions
 * @param startCommand command enabling the evidence (or running the test, for the exerciser)
 * @param stopCommand command disabling the evidence; blank when nothing needs undoing
 * @param artifactPath file produced inside the pod; blank when nothing is copied
 * @param commandTimeout bound on each enable/disable command
 * @param stopTimeout bound on waiting for the source's task during shutdown
 */
public record PodCommandSettings(
    boolean enabled,
    String startCommand,
    String stopCommand,
    String artifactPath,
    Duration commandTimeout,
    Duration stopTimeout) {

  public PodCommandSettings {
    startCommand = startCommand == null ? "" : startCommand.trim();
    stopCommand = stopCommand == null ? "" : stopCommand.trim();
    artifactPath = artifactPath == null ? "" : artifactPath.trim();
    Objects.requireNonNull(commandTimeout, "commandTimeout");
    Objects.requireNonNull(stopTimeout, "stopTimeout");
    if (enabled && startCommand.isEmpty()) {
      throw new IllegalArgumentException("start command is required when the source is enabled");
    }
  }

  public boolean hasArtifact() {
    return !artifactPath.isEmpty();
  }

  public boolean hasStopCommand() {
    return !stopCommand.isEmpty();
  }
}
