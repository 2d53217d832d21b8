package ca.gc.cra.scout.validation;

/**
 * Numeric range checks for configuration values.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer and checks it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or is out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + trimmed + "')", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
