package ca.gc.cra.scout.domain.cluster;

import java.util.Objects;

/**
 * Readiness snapshot for the deployment matched by one pod-name fragment.
 *
 * @param fragment user supplied pod-name fragment
 * @param deployment name of the single deployment containing the fragment
 * @param readyReplicas ready replica count at validation time
 * @param desiredReplicas desired replica count at validation time
 */
public record DeploymentReadiness(
    String fragment, String deployment, int readyReplicas, int desiredReplicas) {

  public DeploymentReadiness {
    Objects.requireNonNull(fragment, "fragment");
    Objects.requireNonNull(deployment, "deployment");
  }

  public static DeploymentReadiness of(String fragment, DeploymentInfo info) {
    return new DeploymentReadiness(
        fragment, info.name(), info.readyReplicas(), info.desiredReplicas());
  }

  public boolean ready() {
    return readyReplicas >= desiredReplicas;
  }
}
