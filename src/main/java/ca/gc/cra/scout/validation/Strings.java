package ca.gc.cra.scout.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and YAML config.
 * <p><strong>Why:</strong> Namespaces and pod fragments end up in Kubernetes API paths and in-pod shell
 * commands, so they are restricted to the characters Kubernetes itself allows.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 * @see Durations
 */
public final class Strings {
  /** RFC 1123 label, as used for namespace names. */
  private static final Pattern DNS_LABEL = Pattern.compile("^[a-z0-9]([-a-z0-9]*[a-z0-9])?$");
  /** Any substring of an RFC 1123 subdomain, as used for deployment and pod name fragments. */
  private static final Pattern NAME_FRAGMENT = Pattern.compile("^[a-z0-9.-]+$");
  private static final int MAX_NAMESPACE_LENGTH = 63;
  private static final int MAX_NAME_LENGTH = 253;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Validates a Kubernetes namespace name (lowercase RFC 1123 label, at most 63 characters).
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate namespace
   * @return trimmed namespace
   * @throws IllegalArgumentException if the value is not a valid namespace name
   */
  public static String requireNamespace(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > MAX_NAMESPACE_LENGTH || !DNS_LABEL.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name,
          "must be a lowercase RFC 1123 label (a-z, 0-9, '-', at most 63 characters)"));
    }
    return trimmed;
  }

  /**
   * Validates a fragment of a deployment or pod name.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate fragment
   * @return trimmed fragment
   * @throws IllegalArgumentException if the fragment contains characters no object name can hold
   */
  public static String requireNameFragment(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > MAX_NAME_LENGTH || !NAME_FRAGMENT.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain lowercase letters, digits, '.' or '-' (was '" + trimmed + "')"));
    }
    return trimmed;
  }

  /**
   * Splits a list value on whitespace and commas, dropping empty tokens.
   *
   * <p>{@code "uecm gateway"}, {@code "uecm,gateway"} and {@code " uecm , gateway "} all yield
   * {@code [uecm, gateway]}.</p>
   *
   * @param raw list text; {@code null} yields an empty list
   * @return tokens in input order
   */
  public static List<String> splitList(String raw) {
    List<String> tokens = new ArrayList<>();
    if (raw == null) {
      return tokens;
    }
    for (String token : raw.split("[\\s,]+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /**
   * Splits a comma-separated list, keeping embedded spaces and dropping empty tokens.
   *
   * @param raw list text; {@code null} yields an empty list
   * @return trimmed tokens in input order
   */
  public static List<String> splitCommaList(String raw) {
    List<String> tokens = new ArrayList<>();
    if (raw == null) {
      return tokens;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        tokens.add(trimmed);
      }
    }
    return tokens;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
