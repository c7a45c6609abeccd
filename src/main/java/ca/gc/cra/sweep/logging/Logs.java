package ca.gc.cra.sweep.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps evaluator diagnostics readable in operator logs.
 * <p><strong>Why:</strong> External evaluators can emit very long warning lines (full parameter dumps); only
 * a bounded prefix is useful in a log line.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so a cut inside a multi-byte character is dropped
 *     instead of raising.
 * @since 0.1.0
 */
public final class Logs {
  /** Default byte budget for evaluator warning samples. */
  public static final int DEFAULT_MAX_BYTES = 240;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to a UTF-8 byte budget and appends the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum bytes retained; must be positive
   * @return original value when it fits, otherwise the truncated prefix with a {@code (truncated, X of Y)}
   *     suffix
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
      prefix = value.substring(0, Math.min(value.length(), maxBytes));
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }

  /**
   * Truncates with {@link #DEFAULT_MAX_BYTES}.
   *
   * @param value string to truncate
   * @return bounded string
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_BYTES);
  }
}
