package ca.gc.cra.scout.application.evidence;

import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.application.port.PodExecPort;
import ca.gc.cra.scout.domain.session.TaskKind;

/** Runs a packet capture in every target pod; the pcap file is copied out after the session. */
public final class CaptureEvidenceSource extends PodToggleEvidenceSource {

  public CaptureEvidenceSource(
      ClusterPort cluster, PodExecPort exec, PodCommandSettings settings, MetricsPort metrics) {
    super(cluster, exec, settings, metrics);
  }

  @Override
  public String name() {
    return "capture";
  }

  @Override
  public TaskKind kind() {
    return TaskKind.CAPTURE;
  }

  @Override
  protected String artifactDirectory() {
    return "capture";
  }
}
