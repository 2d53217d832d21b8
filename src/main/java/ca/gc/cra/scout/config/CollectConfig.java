package ca.gc.cra.scout.config;

import ca.gc.cra.scout.application.evidence.PodCommandSettings;
import ca.gc.cra.scout.application.session.SessionOrchestrator;
import ca.gc.cra.scout.domain.session.CollectionSession;
import ca.gc.cra.scout.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.scout.validation.Durations;
import ca.gc.cra.scout.validation.Numbers;
import ca.gc.cra.scout.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated configuration for the {@code collect} and {@code deployments}
 * commands.
 * <p><strong>Why:</strong> Turns the flat effective map (defaults &lt; YAML &lt; CLI) into typed values
 * once, so the composition root and the orchestrator never see raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param namespace target namespace
 * @param pods pod-name fragments; empty only for commands that do not collect
 * @param keywords case-sensitive error keywords
 * @param pollInterval log watcher polling interval
 * @param timeout bound on the exercising phase
 * @param paths monitored log paths
 * @param queueCapacity error aggregator capacity
 * @param outputDirectory explicit output directory, or {@code null} for the per-session default
 * @param watchPod pod fragment whose filesystem is watched; blank watches the local filesystem
 * @param watchRoot local directory that monitored paths resolve beneath
 * @param watchFromStart whether watchers inspect content that predates the session
 * @param trace trace source commands
 * @param capture packet capture source commands
 * @param exerciserPod pod fragment of the test client
 * @param exerciser exerciser command settings
 * @param commandTimeout bound on each in-pod enable/disable command and on API requests
 * @param stopTimeout bound on waiting for each source while draining
 * @param loggingLevel root log level
 * @param telemetry metrics export settings
 * @since 0.1.0
 */
public record CollectConfig(
    String namespace,
    List<String> pods,
    List<String> keywords,
    Duration pollInterval,
    Duration timeout,
    List<String> paths,
    int queueCapacity,
    Path outputDirectory,
    String watchPod,
    Path watchRoot,
    boolean watchFromStart,
    PodCommandSettings trace,
    PodCommandSettings capture,
    String exerciserPod,
    PodCommandSettings exerciser,
    Duration commandTimeout,
    Duration stopTimeout,
    String loggingLevel,
    TelemetrySettings telemetry) {

  public static final String DEFAULT_NAMESPACE = "default";
  public static final String DEFAULT_KEYWORDS = "error,ERROR,fatal,FATAL,exception,EXCEPTION,panic,PANIC";
  public static final String DEFAULT_PATHS = "/cmconfig.log,/logstore/TspCore,/RTPTraceError,/Envoy,/dumplog";
  public static final String DEFAULT_POLL_INTERVAL = "1s";
  public static final String DEFAULT_TIMEOUT = "10m";
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;
  public static final String DEFAULT_COMMAND_TIMEOUT = "60s";
  public static final String DEFAULT_STOP_TIMEOUT = "30s";

  static final String REMOTE_DIR = "/tmp/scout/{session}";
  public static final String DEFAULT_TRACE_ENABLE =
      "mkdir -p " + REMOTE_DIR + " && /opt/scout/bin/trace-enable " + REMOTE_DIR;
  public static final String DEFAULT_TRACE_DISABLE =
      "/opt/scout/bin/trace-disable " + REMOTE_DIR + " && tar -czf " + REMOTE_DIR + "/trace.tar.gz -C "
          + REMOTE_DIR + " traces";
  public static final String DEFAULT_TRACE_ARTIFACT = REMOTE_DIR + "/trace.tar.gz";
  public static final String DEFAULT_CAPTURE_ENABLE =
      "mkdir -p " + REMOTE_DIR + " && (nohup tcpdump -i any -w " + REMOTE_DIR
          + "/capture.pcap >/dev/null 2>&1 & echo $! > " + REMOTE_DIR + "/tcpdump.pid)";
  public static final String DEFAULT_CAPTURE_DISABLE = "kill $(cat " + REMOTE_DIR + "/tcpdump.pid)";
  public static final String DEFAULT_CAPTURE_ARTIFACT = REMOTE_DIR + "/capture.pcap";
  public static final String DEFAULT_EXERCISER_POD = "testclient";
  public static final String DEFAULT_EXERCISER_COMMAND =
      "mkdir -p " + REMOTE_DIR + " && pybot --outputdir " + REMOTE_DIR + " /opt/tests";
  public static final String DEFAULT_EXERCISER_ARTIFACT = REMOTE_DIR + "/log.html";

  private static final Duration MIN_POLL = Duration.ofMillis(10);
  private static final Duration MAX_POLL = Duration.ofMinutes(10);
  private static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
  private static final Duration MAX_TIMEOUT = Duration.ofHours(24);
  private static final Duration MIN_COMMAND_TIMEOUT = Duration.ofSeconds(1);
  private static final Duration MAX_COMMAND_TIMEOUT = Duration.ofHours(1);

  public CollectConfig {
    Objects.requireNonNull(namespace, "namespace");
    pods = List.copyOf(Objects.requireNonNull(pods, "pods"));
    keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
    paths = List.copyOf(Objects.requireNonNull(paths, "paths"));
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(trace, "trace");
    Objects.requireNonNull(capture, "capture");
    Objects.requireNonNull(exerciser, "exerciser");
    Objects.requireNonNull(commandTimeout, "commandTimeout");
    Objects.requireNonNull(stopTimeout, "stopTimeout");
    Objects.requireNonNull(telemetry, "telemetry");
    Objects.requireNonNull(watchRoot, "watchRoot");
    watchPod = watchPod == null ? "" : watchPod.trim();
    exerciserPod = exerciserPod == null ? "" : exerciserPod.trim();
    loggingLevel = loggingLevel == null || loggingLevel.isBlank() ? "info" : loggingLevel.trim();
    if (keywords.isEmpty()) {
      throw new IllegalArgumentException("keywords must not be empty");
    }
    if (exerciser.enabled() && exerciserPod.isEmpty()) {
      throw new IllegalArgumentException("exerciser.pod is required when the exerciser is enabled");
    }
    if (pollInterval.compareTo(timeout) >= 0) {
      throw new IllegalArgumentException("pollInterval must be shorter than timeout");
    }
  }

  /**
   * Parses a flattened effective configuration map.
   *
   * @param input merged configuration; keys absent from the map take their defaults
   * @return validated configuration
   * @throws IllegalArgumentException when any value is malformed
   */
  public static CollectConfig fromMap(Map<String, String> input) {
    Map<String, String> map = Objects.requireNonNull(input, "input");

    String namespace = Strings.requireNamespace("namespace", value(map, "namespace", DEFAULT_NAMESPACE));
    List<String> pods = new ArrayList<>();
    for (String fragment : Strings.splitList(value(map, "pods", ""))) {
      pods.add(Strings.requireNameFragment("pods", fragment));
    }
    List<String> keywords = Strings.splitCommaList(value(map, "keywords", DEFAULT_KEYWORDS));
    if (keywords.isEmpty()) {
      throw new IllegalArgumentException("keywords must contain at least one keyword");
    }
    List<String> paths = new ArrayList<>();
    for (String path : Strings.splitCommaList(value(map, "paths", DEFAULT_PATHS))) {
      if (!path.startsWith("/")) {
        throw new IllegalArgumentException("paths must be absolute (was '" + path + "')");
      }
      if (Arrays.asList(path.split("/")).contains("..")) {
        throw new IllegalArgumentException("paths must not contain '..' segments (was '" + path + "')");
      }
      if (!paths.contains(path)) {
        paths.add(path);
      }
    }

    Duration pollInterval = Durations.parseInRange(
        "pollInterval", value(map, "pollInterval", DEFAULT_POLL_INTERVAL), MIN_POLL, MAX_POLL);
    Duration timeout = Durations.parseInRange(
        "timeout", value(map, "timeout", DEFAULT_TIMEOUT), MIN_TIMEOUT, MAX_TIMEOUT);
    Duration commandTimeout = Durations.parseInRange("commandTimeout",
        value(map, "commandTimeout", DEFAULT_COMMAND_TIMEOUT), MIN_COMMAND_TIMEOUT, MAX_COMMAND_TIMEOUT);
    Duration stopTimeout = Durations.parseInRange("stopTimeout",
        value(map, "stopTimeout", DEFAULT_STOP_TIMEOUT), MIN_COMMAND_TIMEOUT, MAX_COMMAND_TIMEOUT);
    int queueCapacity = Numbers.parseIntInRange(
        "queueCapacity", value(map, "queueCapacity", Integer.toString(DEFAULT_QUEUE_CAPACITY)), 1, 1_048_576);

    String out = value(map, "out", "");
    Path outputDirectory = out.isBlank() ? null : expandHome(Strings.requireNonBlank("out", out));

    String watchPod = value(map, "watch.pod", "");
    if (!watchPod.isBlank()) {
      Strings.requireNameFragment("watch.pod", watchPod);
    }
    Path watchRoot = Path.of(value(map, "watch.root", "/"));
    boolean watchFromStart = parseBoolean(map, "watch.fromStart", false);

    PodCommandSettings trace = commandSettings(map, "trace", DEFAULT_TRACE_ENABLE,
        DEFAULT_TRACE_DISABLE, DEFAULT_TRACE_ARTIFACT, commandTimeout, stopTimeout);
    PodCommandSettings capture = commandSettings(map, "capture", DEFAULT_CAPTURE_ENABLE,
        DEFAULT_CAPTURE_DISABLE, DEFAULT_CAPTURE_ARTIFACT, commandTimeout, stopTimeout);
    PodCommandSettings exerciser = new PodCommandSettings(
        parseBoolean(map, "exerciser.enabled", true),
        value(map, "exerciser.command", DEFAULT_EXERCISER_COMMAND),
        "",
        value(map, "exerciser.artifact", DEFAULT_EXERCISER_ARTIFACT),
        commandTimeout,
        stopTimeout);
    String exerciserPod = value(map, "exerciser.pod", DEFAULT_EXERCISER_POD);
    if (!exerciserPod.isBlank()) {
      Strings.requireNameFragment("exerciser.pod", exerciserPod);
    }

    TelemetrySettings telemetry = new TelemetrySettings(
        value(map, "metricsExporter", TelemetrySettings.EXPORTER_NONE),
        value(map, "otelEndpoint", ""),
        value(map, "otelResourceAttributes", ""),
        Duration.ofSeconds(30));

    return new CollectConfig(namespace, pods, keywords, pollInterval, timeout, paths, queueCapacity,
        outputDirectory, watchPod, watchRoot, watchFromStart, trace, capture, exerciserPod, exerciser,
        commandTimeout, stopTimeout, value(map, "logging.level", "info"), telemetry);
  }

  /**
   * Builds the immutable session description for one run.
   *
   * @param sessionId identifier of the new session
   * @param startedAt session start
   * @return session value handed to the orchestrator
   * @throws IllegalArgumentException if no pod fragments were configured
   */
  public CollectionSession toSession(String sessionId, Instant startedAt) {
    if (pods.isEmpty()) {
      throw new IllegalArgumentException("pods must name at least one pod fragment");
    }
    return new CollectionSession(sessionId, namespace, pods, startedAt, timeout, pollInterval,
        keywords, paths, resolveOutputDirectory(sessionId));
  }

  /**
   * Resolves the output directory of a session: {@code out} when set, otherwise
   * {@code ~/.scout/out/<sessionId>}.
   *
   * @param sessionId session identifier
   * @return absolute output directory
   */
  public Path resolveOutputDirectory(String sessionId) {
    if (outputDirectory != null) {
      return outputDirectory.toAbsolutePath().normalize();
    }
    return defaultBaseDirectory().resolve(sessionId);
  }

  public SessionOrchestrator.Settings orchestratorSettings() {
    return new SessionOrchestrator.Settings(queueCapacity, watchFromStart, stopTimeout);
  }

  public boolean watchesPod() {
    return !watchPod.isEmpty();
  }

  static Path defaultBaseDirectory() {
    return Path.of(System.getProperty("user.home", "."), ".scout", "out");
  }

  private static PodCommandSettings commandSettings(
      Map<String, String> map,
      String prefix,
      String enableDefault,
      String disableDefault,
      String artifactDefault,
      Duration commandTimeout,
      Duration stopTimeout) {
    return new PodCommandSettings(
        parseBoolean(map, prefix + ".enabled", true),
        value(map, prefix + ".enableCommand", enableDefault),
        value(map, prefix + ".disableCommand", disableDefault),
        value(map, prefix + ".artifact", artifactDefault),
        commandTimeout,
        stopTimeout);
  }

  private static String value(Map<String, String> map, String key, String defaultValue) {
    String raw = map.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return raw.trim();
  }

  private static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String raw = map.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  private static Path expandHome(String raw) {
    if (raw.equals("~") || raw.startsWith("~/")) {
      return Path.of(System.getProperty("user.home", "."), raw.length() > 2 ? raw.substring(2) : "");
    }
    return Path.of(raw);
  }
}
