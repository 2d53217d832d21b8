package ca.gc.cra.scout.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep pod output and matched log lines bounded.
 * <p><strong>Why:</strong> Matched lines and remote stderr can be arbitrarily long; operator logs should not be.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the evidence sources and event sinks.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Collapses line breaks so a multi-line value stays on one log line.
   *
   * @param value text to flatten; {@code null} results in {@code "<null>"}
   * @return value with CR and LF replaced by spaces
   */
  public static String singleLine(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return value.replace('\r', ' ').replace('\n', ' ').strip();
  }
}
