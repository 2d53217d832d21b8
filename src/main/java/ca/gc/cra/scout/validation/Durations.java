package ca.gc.cra.scout.validation;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats the durations used in configuration ({@code pollInterval}, {@code timeout},
 * {@code commandTimeout}).
 *
 * <p>Accepted forms are a number followed by {@code ms}, {@code s}, {@code m} or {@code h}
 * (for example {@code 500ms}, {@code 10m}) and ISO-8601 durations such as {@code PT1M30S}.</p>
 *
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern SIMPLE = Pattern.compile("^(\\d+)\\s*(ms|s|m|h)$");

  private Durations() {
    // Utility
  }

  /**
   * Parses a duration.
   *
   * @param name logical parameter name for diagnostics
   * @param raw text to parse
   * @return parsed duration
   * @throws IllegalArgumentException if the text is blank or malformed
   */
  public static Duration parse(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    Matcher m = SIMPLE.matcher(trimmed);
    if (m.matches()) {
      long amount;
      try {
        amount = Long.parseLong(m.group(1));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(name + " is too large (was '" + raw + "')", ex);
      }
      return switch (m.group(2)) {
        case "ms" -> Duration.ofMillis(amount);
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        default -> Duration.ofHours(amount);
      };
    }
    try {
      return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(
          name + " must look like 500ms, 1s, 10m, 1h or PT10M (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a duration and requires it to lie within {@code [min, max]}.
   *
   * @param name logical parameter name for diagnostics
   * @param raw text to parse
   * @param min minimum inclusive duration
   * @param max maximum inclusive duration
   * @return parsed duration
   */
  public static Duration parseInRange(String name, String raw, Duration min, Duration max) {
    Duration value = parse(name, raw);
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new IllegalArgumentException(
          name + " must be between " + format(min) + " and " + format(max) + " (was " + raw.trim() + ")");
    }
    return value;
  }

  /**
   * Formats a duration in the short form accepted by {@link #parse(String, String)}, using the
   * largest unit that represents it exactly.
   *
   * @param duration non-negative duration
   * @return short form such as {@code 10m} or {@code 1500ms}
   */
  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis % 3_600_000L == 0 && millis != 0) {
      return (millis / 3_600_000L) + "h";
    }
    if (millis % 60_000L == 0 && millis != 0) {
      return (millis / 60_000L) + "m";
    }
    if (millis % 1_000L == 0) {
      return (millis / 1_000L) + "s";
    }
    return millis + "ms";
  }

  /**
   * Formats an age the way {@code kubectl get} does: the largest whole unit, or two units while
   * the age is small ({@code 45s}, {@code 3m12s}, {@code 5h}, {@code 12d}).
   *
   * @param age elapsed time; negative values are treated as zero
   * @return compact age string
   */
  public static String humanAge(Duration age) {
    long seconds = Math.max(0L, age.getSeconds());
    if (seconds < 60) {
      return seconds + "s";
    }
    long minutes = seconds / 60;
    if (minutes < 10) {
      long rem = seconds % 60;
      return rem == 0 ? minutes + "m" : minutes + "m" + rem + "s";
    }
    if (minutes < 60) {
      return minutes + "m";
    }
    long hours = minutes / 60;
    if (hours < 48) {
      return hours + "h";
    }
    return (hours / 24) + "d";
  }
}
