package dev.ito.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Log hygiene helpers for echoing raw log lines in diagnostics.
 *
 * <p>Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to a UTF-8 byte budget and notes the original length.
   *
   * @param value text to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum bytes to keep; must be positive
   * @return {@code value} when it fits, otherwise its prefix followed by {@code "... (truncated, X of Y)"}
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
    String prefix;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = buffer.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }
}
