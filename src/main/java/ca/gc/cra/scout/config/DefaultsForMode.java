package ca.gc.cra.scout.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each scout command.
 *
 * <p>These maps are the lowest layer of the merge; {@link CollectConfig#fromMap(Map)} applies the
 * same values to keys that are absent altogether.</p>
 */
public final class DefaultsForMode {
  public static final String MODE_COLLECT = "collect";
  public static final String MODE_DEPLOYMENTS = "deployments";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command ({@code collect} or {@code deployments})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case MODE_COLLECT -> buildCollectDefaults();
      case MODE_DEPLOYMENTS -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("namespace", CollectConfig.DEFAULT_NAMESPACE);
    map.put("commandTimeout", CollectConfig.DEFAULT_COMMAND_TIMEOUT);
    map.put("logging.level", "info");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildCollectDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("pods", "");
    map.put("keywords", CollectConfig.DEFAULT_KEYWORDS);
    map.put("pollInterval", CollectConfig.DEFAULT_POLL_INTERVAL);
    map.put("timeout", CollectConfig.DEFAULT_TIMEOUT);
    map.put("paths", CollectConfig.DEFAULT_PATHS);
    map.put("queueCapacity", Integer.toString(CollectConfig.DEFAULT_QUEUE_CAPACITY));
    map.put("out", "");
    map.put("watch.pod", "");
    map.put("watch.root", "/");
    map.put("watch.fromStart", "false");
    map.put("trace.enabled", "true");
    map.put("trace.enableCommand", CollectConfig.DEFAULT_TRACE_ENABLE);
    map.put("trace.disableCommand", CollectConfig.DEFAULT_TRACE_DISABLE);
    map.put("trace.artifact", CollectConfig.DEFAULT_TRACE_ARTIFACT);
    map.put("capture.enabled", "true");
    map.put("capture.enableCommand", CollectConfig.DEFAULT_CAPTURE_ENABLE);
    map.put("capture.disableCommand", CollectConfig.DEFAULT_CAPTURE_DISABLE);
    map.put("capture.artifact", CollectConfig.DEFAULT_CAPTURE_ARTIFACT);
    map.put("exerciser.enabled", "true");
    map.put("exerciser.pod", CollectConfig.DEFAULT_EXERCISER_POD);
    map.put("exerciser.command", CollectConfig.DEFAULT_EXERCISER_COMMAND);
    map.put("exerciser.artifact", CollectConfig.DEFAULT_EXERCISER_ARTIFACT);
    map.put("stopTimeout", CollectConfig.DEFAULT_STOP_TIMEOUT);
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
