package ca.gc.cra.ingest.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep secrets and oversized payloads out of logs.
 * <p><strong>Why:</strong> Response bodies can be megabytes long and request headers carry bearer tokens.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate text to a UTF-8 byte budget while preserving readability.</li>
 *   <li>Preview raw response bytes without failing on invalid encodings.</li>
 *   <li>Provide a consistent redaction placeholder for credentials.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

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
    return preview(value.getBytes(StandardCharsets.UTF_8), maxBytes);
  }

  /**
   * Decodes at most {@code maxBytes} of a UTF-8 body for log output, dropping undecodable bytes.
   *
   * @param body raw bytes; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to decode; must be positive
   * @return decoded prefix, suffixed with {@code "... (truncated, X of Y)"} when shortened
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String preview(byte[] body, int maxBytes) {
    if (body == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int length = Math.min(body.length, maxBytes);
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String text;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(body, 0, length));
      text = buffer.toString();
    } catch (CharacterCodingException ex) {
      text = new String(body, 0, length, StandardCharsets.UTF_8);
    }
    if (body.length <= maxBytes) {
      return text;
    }
    return text + "... (truncated, " + maxBytes + " of " + body.length + ")";
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }
}
