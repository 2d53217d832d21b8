package ca.gc.cra.scout.application.evidence;

import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.application.port.PodExecPort;
import ca.gc.cra.scout.domain.session.TaskKind;

/** Enables process tracing in every target pod for the duration of the session. */
public final class TraceEvidenceSource extends PodToggleEvidenceSource {

  public TraceEvidenceSource(
      ClusterPort cluster, PodExecPort exec, PodCommandSettings settings, MetricsPort metrics) {
    super(cluster, exec, settings, metrics);
  }

  @Override
  public String name() {
    return "trace";
  }

  @Override
  public TaskKind kind() {
    return TaskKind.TRACE;
  }

  @Override
  protected String artifactDirectory() {
    return "trace";
  }
}
