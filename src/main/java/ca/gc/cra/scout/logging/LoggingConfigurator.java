package ca.gc.cra.scout.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures scout runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Operators raise verbosity during an incident without editing {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility that bridges {@code --verbose} and {@code logging.level}
 * to the logging backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel("debug");
  }

  /**
   * Sets the root logger level by name ({@code trace}, {@code debug}, {@code info}, {@code warn},
   * {@code error}).
   *
   * @param levelName case-insensitive level name
   * @throws IllegalArgumentException if the name is not a known level
   */
  public static void setRootLevel(String levelName) {
    Level level = parseLevel(levelName);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }

  static Level parseLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      throw new IllegalArgumentException("logging.level must not be blank");
    }
    return switch (levelName.trim().toLowerCase(Locale.ROOT)) {
      case "trace" -> Level.TRACE;
      case "debug" -> Level.DEBUG;
      case "info" -> Level.INFO;
      case "warn", "warning" -> Level.WARN;
      case "error" -> Level.ERROR;
      default -> throw new IllegalArgumentException(
          "logging.level must be one of trace, debug, info, warn, error (was '" + levelName + "')");
    };
  }
}
