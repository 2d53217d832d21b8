package ca.gc.cra.scout.api;

import ca.gc.cra.scout.config.ConfigMerger;
import ca.gc.cra.scout.config.DefaultsForMode;
import ca.gc.cra.scout.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Loads the YAML file (if any) and merges it with defaults and CLI values for {@code mode}.
   *
   * @param mode command name
   * @param configPath YAML path, or {@code null}
   * @param cliKv CLI key/value arguments without {@code config}
   * @param log logger receiving override warnings
   * @return effective configuration
   * @throws CliAbort carrying the exit code when the file is missing, unreadable or invalid
   */
  static Map<String, String> effectiveConfig(
      String mode, String configPath, Map<String, String> cliKv, Logger log) throws CliAbort {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.isRegularFile(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CliAbort(ExitCode.IO_ERROR);
      }
    }
    try {
      return ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      throw new CliAbort(configPath == null ? ExitCode.INVALID_ARGS : ExitCode.CONFIG_ERROR);
    }
  }

  /** Early exit from a CLI flow with a chosen exit code. */
  static final class CliAbort extends Exception {
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
