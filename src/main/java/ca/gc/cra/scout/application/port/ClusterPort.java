package ca.gc.cra.scout.application.port;

import ca.gc.cra.scout.domain.cluster.DeploymentInfo;
import ca.gc.cra.scout.domain.cluster.PodInfo;
import java.util.List;

/**
 * <strong>What:</strong> Read-only view of the Kubernetes API used for preflight checks and target
 * resolution.
 * <p><strong>Why:</strong> Keeps the validator and evidence sources independent of the client
 * library so tests can substitute in-memory clusters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from evidence
 * source tasks.</p>
 *
 * @since 0.1.0
 */
public interface ClusterPort {
  /**
   * Checks whether a namespace exists.
   *
   * @param namespace namespace name
   * @return {@code true} if the namespace exists
   * @throws ClusterException if the API cannot be queried
   */
  boolean namespaceExists(String namespace) throws ClusterException;

  /**
   * Lists deployments in a namespace.
   *
   * @param namespace namespace name
   * @return deployments in API order; empty when none exist
   * @throws ClusterException if the API cannot be queried
   */
  List<DeploymentInfo> listDeployments(String namespace) throws ClusterException;

  /**
   * Lists pods in a namespace.
   *
   * @param namespace namespace name
   * @return pods in API order; empty when none exist
   * @throws ClusterException if the API cannot be queried
   */
  List<PodInfo> listPods(String namespace) throws ClusterException;
}
