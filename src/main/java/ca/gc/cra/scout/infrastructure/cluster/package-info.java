/**
 * Kubernetes adapters built on the fabric8 client.
 * <p><strong>Role:</strong> Implement the cluster and pod exec ports.</p>
 * <p><strong>Concurrency:</strong> The shared {@code KubernetesClient} is thread-safe; each exec owns
 * its own output buffers and websocket.</p>
 */
package ca.gc.cra.scout.infrastructure.cluster;
