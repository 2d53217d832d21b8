package ca.gc.cra.scout.application.session;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.session.PreflightException.Reason;
import ca.gc.cra.scout.domain.cluster.DeploymentInfo;
import ca.gc.cra.scout.domain.cluster.DeploymentReadiness;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Read-only preflight check run before any collection task starts.
 * <p>A session may proceed only if the namespace exists and every pod fragment is contained in the
 * name of exactly one deployment whose ready replicas meet its desired replicas. Fragments are
 * checked in order and the first failure is reported.</p>
 *
 * @since 0.1.0
 */
public final class PreflightValidator {
  private static final Logger log = LoggerFactory.getLogger(PreflightValidator.class);

  private final ClusterPort cluster;

  public PreflightValidator(ClusterPort cluster) {
    this.cluster = Objects.requireNonNull(cluster, "cluster");
  }

  /**
   * Validates the namespace and every fragment.
   *
   * @param namespace target namespace
   * @param fragments pod-name fragments in user order
   * @return readiness of the deployment matched by each fragment, in fragment order
   * @throws PreflightException if a precondition does not hold
   * @throws ClusterException if the cluster cannot be queried
   */
  public List<DeploymentReadiness> validate(String namespace, List<String> fragments)
      throws PreflightException, ClusterException {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(fragments, "fragments");
    if (!cluster.namespaceExists(namespace)) {
      throw new PreflightException(
          Reason.NAMESPACE_NOT_FOUND, namespace, null, "namespace " + namespace + " does not exist");
    }

    List<DeploymentInfo> deployments = cluster.listDeployments(namespace);
    List<DeploymentReadiness> result = new ArrayList<>(fragments.size());
    for (String fragment : fragments) {
      List<DeploymentInfo> matches = deployments.stream()
          .filter(d -> d.name().contains(fragment))
          .collect(Collectors.toList());
      if (matches.isEmpty()) {
        throw new PreflightException(
            Reason.DEPLOYMENT_NOT_FOUND,
            namespace,
            fragment,
            "no deployment in namespace " + namespace + " matches '" + fragment + "'");
      }
      if (matches.size() > 1) {
        String names = matches.stream().map(DeploymentInfo::name).collect(Collectors.joining(", "));
        throw new PreflightException(
            Reason.DEPLOYMENT_AMBIGUOUS,
            namespace,
            fragment,
            "'" + fragment + "' matches several deployments: " + names);
      }
      DeploymentInfo match = matches.get(0);
      if (!match.ready()) {
        throw new PreflightException(
            Reason.DEPLOYMENT_NOT_READY,
            namespace,
            fragment,
            "deployment " + match.name() + " is not ready ("
                + match.readyReplicas() + "/" + match.desiredReplicas() + " replicas)");
      }
      log.debug("Fragment '{}' -> deployment {} ({}/{} ready)",
          fragment, match.name(), match.readyReplicas(), match.desiredReplicas());
      result.add(DeploymentReadiness.of(fragment, match));
    }
    return List.copyOf(result);
  }
}
