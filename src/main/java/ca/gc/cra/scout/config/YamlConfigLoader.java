package ca.gc.cra.scout.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads scout configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <p>The {@code common} section applies to every command; the section named after the command
 * ({@code collect}, {@code deployments}) overrides it. Nested mappings flatten to dotted keys
 * ({@code trace: {enabled: false}} becomes {@code trace.enabled=false}) and sequences of scalars
 * flatten to a comma-joined value, so {@code keywords: [error, FATAL]} and
 * {@code keywords: "error,FATAL"} are equivalent.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode command name
   * @return flat map containing merged configuration; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object modeSection = findSection(root, normalizedMode);
      if (modeSection instanceof Map<?, ?> modeMap) {
        flatten(asMap(modeMap, normalizedMode), "", flattened);
      } else if (modeSection != null) {
        throw new IllegalArgumentException(normalizedMode + " section must be a mapping");
      }

      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joiner = new StringJoiner(",");
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list " + key + " must only contain scalar values");
      }
      String text = item.toString();
      if (text.contains(",")) {
        throw new IllegalArgumentException("YAML list " + key + " entries must not contain commas");
      }
      joiner.add(text);
    }
    return joiner.toString();
  }
}
