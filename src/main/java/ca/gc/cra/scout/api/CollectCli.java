package ca.gc.cra.scout.api;

import ca.gc.cra.scout.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.scout.application.session.PreflightException;
import ca.gc.cra.scout.application.session.SessionOrchestrator;
import ca.gc.cra.scout.config.CollectConfig;
import ca.gc.cra.scout.config.CompositionRoot;
import ca.gc.cra.scout.config.DefaultsForMode;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.domain.session.SessionIds;
import ca.gc.cra.scout.domain.session.SessionReport;
import ca.gc.cra.scout.infrastructure.report.JsonSessionReportWriter;
import ca.gc.cra.scout.logging.LoggingConfigurator;
import ca.gc.cra.scout.validation.Durations;
import ca.gc.cra.scout.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for one symptom collection session.
 *
 * <p>Exit codes: {@code 0} when the session closed (warnings included), {@code 6} when preflight
 * validation rejected the namespace or a deployment, {@code 2}/{@code 4} for argument and
 * configuration problems, {@code 3} when the cluster or output directory could not be used and
 * {@code 130} when interrupted.</p>
 *
 * @since 0.1.0
 */
public final class CollectCli {
  private static final Logger log = LoggerFactory.getLogger(CollectCli.class);
  private static final String MODE = DefaultsForMode.MODE_COLLECT;
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
  private static final String SUMMARY_USAGE =
      "usage: collect pods=\"<fragment> [fragment...]\" [namespace=NS] [timeout=10m] [pollInterval=1s] "
          + "[keywords=a,b] [paths=/p1,/p2] [out=PATH] [config=scout.yaml] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      scout collect: gather symptoms while the exerciser runs

      Usage:
        collect pods="uecm gateway" [options]

      Required:
        pods="A B"                  Pod-name fragments; each must match exactly one ready deployment
                                    (alias pod=..., -p, --pods)

      Optional (validated):
        namespace=NS                Kubernetes namespace (default default; alias ns=..., -n, --namespace)
        timeout=DURATION            Upper bound on the exercising phase, 1s-24h (default 10m)
        pollInterval=DURATION       Log watcher polling interval, 10ms-10m (default 1s)
        keywords=a,b,c              Case-sensitive substrings marking an error line
        paths=/a,/b                 Absolute log files or directories to watch
        watch.pod=FRAGMENT          Read watched paths inside this pod; set it when the logs live
                                    in the workload rather than on the host running scout
        watch.root=DIR              Without watch.pod, paths are read on the host running scout,
                                    resolved under DIR (default /)
        watch.fromStart=true|false  Report matches already present when the session starts
        queueCapacity=1-1048576     Error event buffer size (default 1024)
        trace.enabled=true|false    Toggle trace instrumentation (default true)
        capture.enabled=true|false  Toggle packet capture (default true)
        exerciser.enabled=true|false  Run the test suite (default true); off runs until timeout
        exerciser.pod=FRAGMENT      Pod that runs the test suite (default testclient)
        commandTimeout=DURATION     Bound on pod commands and API calls (default 60s)
        stopTimeout=DURATION        Bound on stopping sources and joining tasks (default 30s)
        out=PATH                    Output directory (default ~/.scout/out/<session>)
        config=PATH                 YAML file with common/collect sections (alias -c, --config)
        logging.level=LEVEL         trace|debug|info|warn|error (default info)
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate inputs and print the plan without touching the cluster
        --allow-overwrite           Permit writing into a non-empty output directory
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Exit codes:
        0 closed, 2 invalid arguments, 3 cluster or I/O failure, 4 configuration error,
        5 unexpected failure, 6 validation failed, 130 interrupted
      """;

  private CollectCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the collect command and returns a standardized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code that callers can inspect
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Function<CollectConfig, CompositionRoot> rootFactory) {
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
      log.debug("Verbose logging enabled for collect CLI");
    }

    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, configPath, cliKv, log);
    } catch (CliAbort abort) {
      CliPrinter.println(SUMMARY_USAGE);
      return abort.exitCode();
    }
    ExecutionFlags flags = ExecutionFlags.from(input, effective);

    CollectConfig config;
    try {
      config = CollectConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid collect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return configPath == null ? ExitCode.INVALID_ARGS : ExitCode.CONFIG_ERROR;
    }
    if (!input.verbose()) {
      try {
        LoggingConfigurator.setRootLevel(config.loggingLevel());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid logging configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    }

    Instant startedAt = Instant.now();
    CollectionSession session;
    Path outputDirectory;
    try {
      session = config.toSession(SessionIds.next(startedAt), startedAt);
      outputDirectory = Paths.validateOutputDir(session.outputDirectory(), flags.allowOverwrite());
      session = session.withOutputDirectory(outputDirectory);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid collect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.info("Configured session {}: namespace={}, pods={}, timeout={}, paths={}, metricsExporter={}",
        session.sessionId(), session.namespace(), session.podFragments(),
        Durations.format(session.timeout()), session.monitoredPaths().size(),
        config.telemetry().exporter());

    if (flags.dryRun()) {
      printDryRunPlan(config, session, outputDirectory, flags.allowOverwrite());
      return ExitCode.SUCCESS;
    }
    return executeSession(config, session, rootFactory);
  }

  private static ExitCode executeSession(
      CollectConfig config,
      CollectionSession session,
      Function<CollectConfig, CompositionRoot> rootFactory) {
    try (CompositionRoot root = rootFactory.apply(config)) {
      SessionOrchestrator orchestrator = root.sessionOrchestrator();
      InterruptHook hook = InterruptHook.install(Thread.currentThread());
      try {
        SessionReport report = orchestrator.run(session);
        CliPrinter.printBlock(JsonSessionReportWriter.summary(report));
        CliPrinter.println("Output: " + report.outputDirectory());
        log.info("Session {} closed in {} with {} error events",
            report.sessionId(), Durations.format(report.duration()), report.totalEvents());
        return ExitCode.SUCCESS;
      } finally {
        hook.release();
      }
    } catch (PreflightException ex) {
      log.error("Validation failed ({}): {}", ex.reason(), ex.getMessage());
      CliPrinter.println("Validation failed: " + ex.getMessage());
      return ExitCode.VALIDATION_FAILED;
    } catch (IOException ex) {
      log.error("Session {} failed: {}", session.sessionId(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Session {} interrupted; collected evidence was drained to {}",
          session.sessionId(), session.outputDirectory());
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Session configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in session {}", session.sessionId(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      CollectConfig config, CollectionSession session, Path outputDirectory, boolean allowOverwrite) {
    CliPrinter.println("Collect dry-run plan:");
    CliPrinter.printf("  Session:        %s", session.sessionId());
    CliPrinter.printf("  Namespace:      %s", session.namespace());
    CliPrinter.printf("  Pods:           %s", String.join(" ", session.podFragments()));
    CliPrinter.printf("  Timeout:        %s", Durations.format(session.timeout()));
    CliPrinter.printf("  Poll interval:  %s", Durations.format(session.pollInterval()));
    CliPrinter.printf("  Keywords:       %s", String.join(",", session.keywords()));
    CliPrinter.printf("  Paths:          %s", String.join(",", session.monitoredPaths()));
    CliPrinter.printf("  Watch source:   %s",
        config.watchesPod() ? "pod " + config.watchPod() : "local " + config.watchRoot());
    CliPrinter.printf("  Trace:          %s", config.trace().enabled() ? "enabled" : "disabled");
    CliPrinter.printf("  Capture:        %s", config.capture().enabled() ? "enabled" : "disabled");
    CliPrinter.printf("  Exerciser:      %s",
        config.exerciser().enabled() ? "pod " + config.exerciserPod() : "disabled (runs until timeout)");
    CliPrinter.printf("  Output:         %s%s", outputDirectory, allowOverwrite ? " (reuse allowed)" : "");
  }

  private record ExecutionFlags(boolean dryRun, boolean allowOverwrite) {
    static ExecutionFlags from(CliInput input, Map<String, String> configValues) {
      boolean dryRun = input.hasFlag("--dry-run")
          || ConfigCliUtils.parseBoolean(configValues, "dryRun");
      boolean allowOverwrite = input.hasFlag("--allow-overwrite")
          || ConfigCliUtils.parseBoolean(configValues, "allowOverwrite");
      return new ExecutionFlags(dryRun, allowOverwrite);
    }
  }

  /**
   * Turns SIGINT/SIGTERM into an interrupt of the session thread and holds JVM shutdown until the
   * session has drained and written its report.
   */
  private static final class InterruptHook {
    private final Thread sessionThread;
    private final CountDownLatch drained = new CountDownLatch(1);
    private final Thread hook;

    private InterruptHook(Thread sessionThread) {
      this.sessionThread = sessionThread;
      this.hook = new Thread(this::onShutdown, "scout-shutdown");
    }

    static InterruptHook install(Thread sessionThread) {
      InterruptHook interruptHook = new InterruptHook(sessionThread);
      Runtime.getRuntime().addShutdownHook(interruptHook.hook);
      return interruptHook;
    }

    private void onShutdown() {
      log.warn("Shutdown requested; draining session");
      sessionThread.interrupt();
      try {
        if (!drained.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Session did not drain within {}", Durations.format(SHUTDOWN_GRACE));
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }

    void release() {
      drained.countDown();
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException ex) {
        log.debug("JVM shutdown in progress; shutdown hook stays registered");
      }
    }
  }
}
