package ca.gc.cra.scout.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = normalizeAliases(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = normalizeAliases(cli == null ? Map.of() : cli);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  /**
   * Rewrites short key forms ({@code ns}, {@code pod}) to their canonical names. A canonical key
   * wins over its alias when both are present.
   */
  private static Map<String, String> normalizeAliases(Map<String, String> source) {
    Map<String, String> normalized = new LinkedHashMap<>(source);
    rename(normalized, "ns", "namespace");
    rename(normalized, "pod", "pods");
    return normalized;
  }

  private static void rename(Map<String, String> map, String alias, String canonical) {
    String value = map.remove(alias);
    if (value != null && !map.containsKey(canonical)) {
      map.put(canonical, value);
    }
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (DefaultsForMode.MODE_COLLECT.equals(mode.trim().toLowerCase(Locale.ROOT))) {
      if (trim(effective.get("pods")).isEmpty()) {
        throw new IllegalArgumentException("pods is required (e.g. pods=\"uecm gateway\")");
      }
      boolean traceEnabled = parseBoolean(effective.get("trace.enabled"), true);
      if (traceEnabled && trim(effective.get("trace.enableCommand")).isEmpty()) {
        throw new IllegalArgumentException("trace.enableCommand is required when trace.enabled=true");
      }
      boolean captureEnabled = parseBoolean(effective.get("capture.enabled"), true);
      if (captureEnabled && trim(effective.get("capture.enableCommand")).isEmpty()) {
        throw new IllegalArgumentException("capture.enableCommand is required when capture.enabled=true");
      }
    }
    if (trim(effective.get("namespace")).isEmpty()) {
      throw new IllegalArgumentException("namespace must not be blank");
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
