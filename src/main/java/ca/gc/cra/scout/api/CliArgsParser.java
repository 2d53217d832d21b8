package ca.gc.cra.scout.api;

import ca.gc.cra.scout.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}.
   *
   * <p>Values may contain spaces ({@code pods="uecm gateway"} arrives as one argument) and further
   * {@code '='} characters ({@code otelResourceAttributes=a=b,c=d}).</p>
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the argument prefix prior to {@code '='}
   * @throws IllegalArgumentException if an argument is not {@code key=value} or is malformed
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }
}
