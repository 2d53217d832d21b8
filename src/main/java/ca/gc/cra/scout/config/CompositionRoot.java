package ca.gc.cra.scout.config;

import ca.gc.cra.scout.application.evidence.CaptureEvidenceSource;
import ca.gc.cra.scout.application.evidence.EvidenceSource;
import ca.gc.cra.scout.application.evidence.ExerciserEvidenceSource;
import ca.gc.cra.scout.application.evidence.TraceEvidenceSource;
import ca.gc.cra.scout.application.port.ClockPort;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.application.port.LogTailPort;
import ca.gc.cra.scout.application.port.MetricsPort;
import ca.gc.cra.scout.application.port.PodExecPort;
import ca.gc.cra.scout.application.port.SessionReportWriter;
import ca.gc.cra.scout.application.session.PreflightValidator;
import ca.gc.cra.scout.application.session.SessionOrchestrator;
import ca.gc.cra.scout.infrastructure.cluster.Fabric8ClusterAdapter;
import ca.gc.cra.scout.infrastructure.cluster.Fabric8PodExecAdapter;
import ca.gc.cra.scout.infrastructure.cluster.KubernetesClients;
import ca.gc.cra.scout.infrastructure.events.LoggingErrorEventSink;
import ca.gc.cra.scout.infrastructure.logtail.LocalFileLogTail;
import ca.gc.cra.scout.infrastructure.logtail.PodFileLogTail;
import ca.gc.cra.scout.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.scout.infrastructure.report.JsonSessionReportWriter;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the session orchestrator and the {@code deployments} listing to concrete
 * adapters.
 * <p><strong>Why:</strong> One place translates {@link CollectConfig} into the object graph; the CLI
 * never instantiates adapters itself.</p>
 * <ul>
 *   <li>Kubernetes access goes through one lazily created fabric8 client shared by the cluster and
 *   exec adapters.</li>
 *   <li>Log watchers read the local filesystem, or a workload pod when {@code watch.pod} is set.</li>
 *   <li>Detected events go to the logging sink and, at close, to the JSON report writer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build on the CLI thread; the produced graph is used by one session.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final CollectConfig config;
  private final MetricsPort metrics;
  private final Supplier<KubernetesClient> clientFactory;
  private KubernetesClient client;
  private ClusterPort cluster;
  private PodExecPort exec;

  /**
   * Creates a root that talks to the cluster selected by the ambient kubeconfig.
   *
   * @param config validated configuration
   */
  public CompositionRoot(CollectConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(config.telemetry()),
        () -> KubernetesClients.create(config.commandTimeout()));
  }

  /**
   * Creates a root with an explicit metrics adapter and client factory.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by every component
   * @param clientFactory supplies the fabric8 client on first use
   */
  public CompositionRoot(CollectConfig config, MetricsPort metrics, Supplier<KubernetesClient> clientFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  /**
   * Creates a root around pre-built cluster and exec ports.
   *
   * @param config validated configuration
   * @param metrics metrics adapter
   * @param cluster cluster port
   * @param exec pod exec port
   */
  public CompositionRoot(CollectConfig config, MetricsPort metrics, ClusterPort cluster, PodExecPort exec) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clientFactory = () -> {
      throw new IllegalStateException("no Kubernetes client configured");
    };
    this.cluster = Objects.requireNonNull(cluster, "cluster");
    this.exec = Objects.requireNonNull(exec, "exec");
  }

  public CollectConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public synchronized ClusterPort clusterPort() {
    if (cluster == null) {
      cluster = new Fabric8ClusterAdapter(client());
    }
    return cluster;
  }

  public synchronized PodExecPort podExecPort() {
    if (exec == null) {
      exec = new Fabric8PodExecAdapter(client());
    }
    return exec;
  }

  public LogTailPort logTailPort() {
    if (config.watchesPod()) {
      log.info("Watching log paths inside pod matching '{}'", config.watchPod());
      return new PodFileLogTail(clusterPort(), podExecPort(), config.namespace(), config.watchPod(),
          config.commandTimeout());
    }
    log.info("Watching log paths on this host under {}; set watch.pod to read them inside a pod",
        config.watchRoot());
    return new LocalFileLogTail(config.watchRoot());
  }

  public PreflightValidator preflightValidator() {
    return new PreflightValidator(clusterPort());
  }

  /**
   * Builds the enabled trace and capture sources, in that order.
   *
   * @return instrumentation sources; empty when both are disabled
   */
  public List<EvidenceSource> instrumentationSources() {
    List<EvidenceSource> sources = new ArrayList<>(2);
    if (config.trace().enabled()) {
      sources.add(new TraceEvidenceSource(clusterPort(), podExecPort(), config.trace(), metrics));
    }
    if (config.capture().enabled()) {
      sources.add(new CaptureEvidenceSource(clusterPort(), podExecPort(), config.capture(), metrics));
    }
    return sources;
  }

  /**
   * Builds the exerciser source.
   *
   * @return exerciser, or {@code null} when {@code exerciser.enabled=false}
   */
  public EvidenceSource exerciserSource() {
    if (!config.exerciser().enabled()) {
      return null;
    }
    return new ExerciserEvidenceSource(clusterPort(), podExecPort(), config.exerciserPod(),
        config.exerciser(), metrics);
  }

  public SessionReportWriter reportWriter() {
    return new JsonSessionReportWriter();
  }

  public SessionOrchestrator sessionOrchestrator() {
    return new SessionOrchestrator(
        preflightValidator(),
        instrumentationSources(),
        exerciserSource(),
        logTailPort(),
        List.of(new LoggingErrorEventSink(metrics)),
        reportWriter(),
        config.orchestratorSettings(),
        ClockPort.SYSTEM,
        metrics);
  }

  private KubernetesClient client() {
    if (client == null) {
      client = clientFactory.get();
      log.debug("Kubernetes client connected to {}", client.getMasterUrl());
    }
    return client;
  }

  @Override
  public synchronized void close() {
    if (client != null) {
      client.close();
      client = null;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
