package ca.gc.cra.scout.domain.cluster;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of a deployment as reported by the cluster API.
 *
 * @param name deployment name
 * @param readyReplicas replicas reporting ready; {@code 0} when the status is absent
 * @param desiredReplicas replicas requested by the spec; Kubernetes defaults this to {@code 1}
 * @param createdAt creation timestamp or {@code null} when the API omitted it
 * @param image first container image, empty when the template has no containers
 * @since 0.1.0
 */
public record DeploymentInfo(
    String name, int readyReplicas, int desiredReplicas, Instant createdAt, String image) {

  public DeploymentInfo {
    Objects.requireNonNull(name, "name");
    if (readyReplicas < 0 || desiredReplicas < 0) {
      throw new IllegalArgumentException("replica counts must be >= 0");
    }
    image = image == null ? "" : image;
  }

  /**
   * Indicates whether every desired replica is ready.
   *
   * @return {@code true} when ready replicas meet or exceed the desired count
   */
  public boolean ready() {
    return readyReplicas >= desiredReplicas;
  }
}
