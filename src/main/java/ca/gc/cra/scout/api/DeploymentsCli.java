package ca.gc.cra.scout.api;

import ca.gc.cra.scout.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.scout.application.port.ClusterException;
import ca.gc.cra.scout.application.port.ClusterPort;
import ca.gc.cra.scout.config.CollectConfig;
import ca.gc.cra.scout.config.CompositionRoot;
import ca.gc.cra.scout.config.DefaultsForMode;
import ca.gc.cra.scout.domain.cluster.DeploymentInfo;
import ca.gc.cra.scout.logging.LoggingConfigurator;
import ca.gc.cra.scout.validation.Durations;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the deployments of a namespace with their readiness, the same view preflight validation
 * uses, so operators can pick pod fragments before running {@code collect}.
 *
 * @since 0.1.0
 */
public final class DeploymentsCli {
  private static final Logger log = LoggerFactory.getLogger(DeploymentsCli.class);
  private static final String MODE = DefaultsForMode.MODE_DEPLOYMENTS;
  private static final String ROW_FORMAT = "%-40s %-7s %-6s %s";
  private static final String SUMMARY_USAGE =
      "usage: deployments [namespace=NS] [pods=\"fragment ...\"] [config=scout.yaml]";
  private static final String HELP_TEXT = """
      scout deployments: list deployments and their readiness

      Usage:
        deployments [namespace=NS] [options]

      Optional:
        namespace=NS          Kubernetes namespace (default default; alias ns=..., -n, --namespace)
        pods="A B"            Only show deployments whose name contains one of the fragments
        commandTimeout=DUR    Bound on API calls (default 60s)
        config=PATH           YAML file with common/deployments sections
        --verbose             Enable DEBUG logging
        --help                Show this message

      A deployment is READY when ready replicas meet the desired count.
      """;

  private DeploymentsCli() {}

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new, Instant::now);
  }

  static ExitCode run(
      String[] args,
      Function<CollectConfig, CompositionRoot> rootFactory,
      Supplier<Instant> now) {
    CliInput input;
    Map<String, String> cliKv;
    try {
      input = CliInput.parse(args);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    CollectConfig config;
    try {
      config = CollectConfig.fromMap(ConfigCliUtils.effectiveConfig(MODE, configPath, cliKv, log));
    } catch (CliAbort abort) {
      CliPrinter.println(SUMMARY_USAGE);
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid deployments arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = rootFactory.apply(config)) {
      ClusterPort cluster = root.clusterPort();
      String namespace = config.namespace();
      if (!cluster.namespaceExists(namespace)) {
        log.error("Namespace {} does not exist", namespace);
        CliPrinter.println("Namespace " + namespace + " does not exist");
        return ExitCode.VALIDATION_FAILED;
      }
      List<DeploymentInfo> deployments = filter(cluster.listDeployments(namespace), config.pods());
      deployments.sort(Comparator.comparing(DeploymentInfo::name));
      printTable(deployments, now.get());
      log.debug("Listed {} deployments in {}", deployments.size(), namespace);
      return ExitCode.SUCCESS;
    } catch (ClusterException ex) {
      log.error("Unable to list deployments: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure listing deployments", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static List<DeploymentInfo> filter(List<DeploymentInfo> all, List<String> fragments) {
    List<DeploymentInfo> result = new ArrayList<>();
    for (DeploymentInfo info : all) {
      if (fragments.isEmpty() || fragments.stream().anyMatch(f -> info.name().contains(f))) {
        result.add(info);
      }
    }
    return result;
  }

  private static void printTable(List<DeploymentInfo> deployments, Instant now) {
    CliPrinter.printf(ROW_FORMAT, "NAME", "READY", "AGE", "IMAGE");
    for (DeploymentInfo info : deployments) {
      String age = info.createdAt() == null
          ? "-"
          : Durations.humanAge(Duration.between(info.createdAt(), now));
      CliPrinter.printf(ROW_FORMAT,
          info.name(),
          info.readyReplicas() + "/" + info.desiredReplicas(),
          age,
          info.image().isEmpty() ? "-" : info.image());
    }
  }
}
