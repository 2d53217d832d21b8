package ca.gc.cra.scout.infrastructure.cluster;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import java.time.Duration;

/**
 * Builds fabric8 clients from the ambient kubeconfig or in-cluster service account.
 */
public final class KubernetesClients {
  private KubernetesClients() {}

  /**
   * Creates a client using auto-detected configuration with the given request timeout.
   *
   * @param requestTimeout per-request timeout for API calls
   * @return new client; caller closes it
   */
  public static KubernetesClient create(Duration requestTimeout) {
    Config config = new ConfigBuilder(Config.autoConfigure(null))
        .withRequestTimeout((int) Math.min(Integer.MAX_VALUE, requestTimeout.toMillis()))
        .withConnectionTimeout((int) Math.min(Integer.MAX_VALUE, requestTimeout.toMillis()))
        .build();
    return new KubernetesClientBuilder().withConfig(config).build();
  }
}
