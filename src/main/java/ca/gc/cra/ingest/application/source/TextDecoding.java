package ca.gc.cra.ingest.application.source;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes file bytes as strict UTF-8, falling back to a configured legacy charset.
 *
 * @since 0.1.0
 */
public final class TextDecoding {
  private static final Logger log = LoggerFactory.getLogger(TextDecoding.class);
  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  private TextDecoding() {
    // Utility
  }

  /**
   * Decodes bytes to text.
   *
   * @param bytes raw file content
   * @param fallback charset used when the bytes are not valid UTF-8
   * @return decoded text with any UTF-8 byte order mark removed
   */
  public static String decode(byte[] bytes, Charset fallback) {
    Objects.requireNonNull(bytes, "bytes");
    Objects.requireNonNull(fallback, "fallback");
    int offset = hasBom(bytes) ? UTF8_BOM.length : 0;
    CharsetDecoder strict = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return strict.decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset)).toString();
    } catch (CharacterCodingException ex) {
      log.debug("Content is not valid UTF-8 ({}); decoding as {}", ex.getMessage(), fallback.name());
      return new String(bytes, fallback);
    }
  }

  private static boolean hasBom(byte[] bytes) {
    return bytes.length >= UTF8_BOM.length
        && bytes[0] == UTF8_BOM[0]
        && bytes[1] == UTF8_BOM[1]
        && bytes[2] == UTF8_BOM[2];
  }
}
