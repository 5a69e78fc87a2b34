package ca.gc.cra.chunkio.domain.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Strict UTF-8 decoding for byte-valued record fields.
 * <p><strong>Role:</strong> Domain support class shared by the metadata codec and row serialization.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a fresh decoder is created per call.</p>
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Decodes the whole array as UTF-8, rejecting malformed or unmappable input.
   *
   * @param data bytes to decode; {@code null} yields an empty string
   * @return decoded text
   * @throws IllegalArgumentException if {@code data} is not valid UTF-8
   */
  public static String decodeStrict(byte[] data) {
    if (data == null || data.length == 0) {
      return "";
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(data)).toString();
    } catch (CharacterCodingException ex) {
      throw new IllegalArgumentException("byte value is not valid UTF-8 text (" + data.length + " bytes)", ex);
    }
  }
}
