package ca.gc.cra.scout.infrastructure.cluster;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.domain.cluster.DeploymentInfo;
import ca.gc.cra.scout.domain.cluster.PodInfo;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentSpec;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.net.HttpURLConnection;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClusterPort} backed by the fabric8 Kubernetes client.
 *
 * <p>Missing replica fields follow Kubernetes defaults: an absent {@code spec.replicas} means one
 * desired replica, an absent {@code status.readyReplicas} means none ready.</p>
 */
public final class Fabric8ClusterAdapter implements ClusterPort {
  private static final Logger log = LoggerFactory.getLogger(Fabric8ClusterAdapter.class);

  private final KubernetesClient client;

  public Fabric8ClusterAdapter(KubernetesClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public boolean namespaceExists(String namespace) throws ClusterException {
    try {
      return client.namespaces().withName(namespace).get() != null;
    } catch (KubernetesClientException ex) {
      if (ex.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
        return false;
      }
      throw wrap("look up namespace " + namespace, ex);
    }
  }

  @Override
  public List<DeploymentInfo> listDeployments(String namespace) throws ClusterException {
    List<Deployment> items;
    try {
      items = client.apps().deployments().inNamespace(namespace).list().getItems();
    } catch (KubernetesClientException ex) {
      throw wrap("list deployments in " + namespace, ex);
    }
    List<DeploymentInfo> result = new ArrayList<>(items.size());
    for (Deployment deployment : items) {
      result.add(toInfo(deployment));
    }
    return result;
  }

  @Override
  public List<PodInfo> listPods(String namespace) throws ClusterException {
    List<Pod> items;
    try {
      items = client.pods().inNamespace(namespace).list().getItems();
    } catch (KubernetesClientException ex) {
      throw wrap("list pods in " + namespace, ex);
    }
    List<PodInfo> result = new ArrayList<>(items.size());
    for (Pod pod : items) {
      String phase = pod.getStatus() == null ? null : pod.getStatus().getPhase();
      result.add(new PodInfo(pod.getMetadata().getName(), phase, isReady(pod)));
    }
    return result;
  }

  static DeploymentInfo toInfo(Deployment deployment) {
    DeploymentSpec spec = deployment.getSpec();
    DeploymentStatus status = deployment.getStatus();
    int desired = spec == null || spec.getReplicas() == null ? 1 : spec.getReplicas();
    int ready = status == null || status.getReadyReplicas() == null ? 0 : status.getReadyReplicas();
    return new DeploymentInfo(
        deployment.getMetadata().getName(),
        ready,
        desired,
        parseTimestamp(deployment.getMetadata().getCreationTimestamp()),
        firstImage(spec));
  }

  private static String firstImage(DeploymentSpec spec) {
    if (spec == null || spec.getTemplate() == null || spec.getTemplate().getSpec() == null) {
      return "";
    }
    List<Container> containers = spec.getTemplate().getSpec().getContainers();
    if (containers == null || containers.isEmpty()) {
      return "";
    }
    String image = containers.get(0).getImage();
    return image == null ? "" : image;
  }

  private static Instant parseTimestamp(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      log.debug("Ignoring unparseable creation timestamp {}", raw);
      return null;
    }
  }

  private static boolean isReady(Pod pod) {
    if (pod.getStatus() == null || pod.getStatus().getConditions() == null) {
      return false;
    }
    for (PodCondition condition : pod.getStatus().getConditions()) {
      if ("Ready".equals(condition.getType())) {
        return "True".equals(condition.getStatus());
      }
    }
    return false;
  }

  private static ClusterException wrap(String action, KubernetesClientException ex) {
    String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return new ClusterException("unable to " + action + " (HTTP " + ex.getCode() + "): " + detail, ex);
  }
}
