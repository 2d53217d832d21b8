package ca.gc.cra.scout.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.session.PreflightException.Reason;
import ca.gc.cra.scout.domain.cluster.DeploymentReadiness;
import ca.gc.cra.scout.testutil.FakeClusterPort;
import java.util.List;
import org.junit.jupiter.api.Test;

class PreflightValidatorTest {

  @Test
  void acceptsReadyDeploymentsInFragmentOrder() throws Exception {
    FakeClusterPort cluster = new FakeClusterPort()
        .withDeployment("prod", "uecm-core", 3, 3)
        .withDeployment("prod", "api-gateway", 2, 2);

    List<DeploymentReadiness> result =
        new PreflightValidator(cluster).validate("prod", List.of("gateway", "uecm"));

    assertEquals(2, result.size());
    assertEquals("gateway", result.get(0).fragment());
    assertEquals("api-gateway", result.get(0).deployment());
    assertEquals("uecm-core", result.get(1).deployment());
  }

  @Test
  void missingNamespaceFailsBeforeListingDeployments() {
    FakeClusterPort cluster = new FakeClusterPort().withDeployment("prod", "uecm-core", 1, 1);

    PreflightException ex = assertThrows(PreflightException.class,
        () -> new PreflightValidator(cluster).validate("staging", List.of("uecm")));

    assertEquals(Reason.NAMESPACE_NOT_FOUND, ex.reason());
    assertEquals("staging", ex.namespace());
    assertNull(ex.fragment());
    assertEquals(1, cluster.calls());
  }

  @Test
  void unknownFragmentIsRejected() {
    FakeClusterPort cluster = new FakeClusterPort().withDeployment("default", "gateway", 1, 1);

    PreflightException ex = assertThrows(PreflightException.class,
        () -> new PreflightValidator(cluster).validate("default", List.of("uecm")));

    assertEquals(Reason.DEPLOYMENT_NOT_FOUND, ex.reason());
    assertEquals("uecm", ex.fragment());
  }

  @Test
  void fragmentMatchingSeveralDeploymentsIsAmbiguous() {
    FakeClusterPort cluster = new FakeClusterPort()
        .withDeployment("default", "uecm-core", 1, 1)
        .withDeployment("default", "uecm-worker", 1, 1);

    PreflightException ex = assertThrows(PreflightException.class,
        () -> new PreflightValidator(cluster).validate("default", List.of("uecm")));

    assertEquals(Reason.DEPLOYMENT_AMBIGUOUS, ex.reason());
    assertTrue(ex.getMessage().contains("uecm-core"));
    assertTrue(ex.getMessage().contains("uecm-worker"));
  }

  @Test
  void deploymentWithFewerReadyReplicasIsNotReady() {
    FakeClusterPort cluster = new FakeClusterPort()
        .withDeployment("default", "gateway", 1, 1)
        .withDeployment("default", "uecm-core", 1, 3);

    PreflightException ex = assertThrows(PreflightException.class,
        () -> new PreflightValidator(cluster).validate("default", List.of("gateway", "uecm")));

    assertEquals(Reason.DEPLOYMENT_NOT_READY, ex.reason());
    assertEquals("uecm", ex.fragment());
    assertTrue(ex.getMessage().contains("1/3"));
  }

  @Test
  void scaledToZeroDeploymentCountsAsReady() throws Exception {
    FakeClusterPort cluster = new FakeClusterPort().withDeployment("default", "idle", 0, 0);

    List<DeploymentReadiness> result =
        new PreflightValidator(cluster).validate("default", List.of("idle"));

    assertTrue(result.get(0).ready());
  }

  @Test
  void clusterFailuresPropagate() {
    FakeClusterPort cluster = new FakeClusterPort()
        .withNamespace("default")
        .failingWith(new ClusterException("connection refused"));

    assertThrows(ClusterException.class,
        () -> new PreflightValidator(cluster).validate("default", List.of("uecm")));
  }
}
