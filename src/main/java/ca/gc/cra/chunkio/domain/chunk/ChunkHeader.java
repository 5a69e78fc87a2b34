package ca.gc.cra.chunkio.domain.chunk;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Header line that precedes every chunk: {@code chunked 1.0,<metadata_length>,<body_length>\n}.
 *
 * @param metadataLength byte length of the metadata block; never negative
 * @param bodyLength byte length of the body block; never negative
 * @since 0.1.0
 */
public record ChunkHeader(int metadataLength, int bodyLength) {
  /** Protocol marker and version that open each header line. */
  public static final String PREFIX = "chunked 1.0,";

  private static final Pattern LINE = Pattern.compile("chunked 1\\.0,(\\d{1,10}),(\\d{1,10})\\n?");

  /**
   * Validates the block lengths.
   *
   * @throws IllegalArgumentException if a length is negative
   */
  public ChunkHeader {
    if (metadataLength < 0 || bodyLength < 0) {
      throw new IllegalArgumentException(
          "chunk lengths must not be negative (metadata=" + metadataLength + ", body=" + bodyLength + ")");
    }
  }

  /**
   * Renders the header line, including the trailing newline.
   *
   * @return header text
   */
  public String format() {
    return PREFIX + metadataLength + ',' + bodyLength + '\n';
  }

  /**
   * Renders the header line as ASCII bytes.
   *
   * @return header bytes, newline included
   */
  public byte[] toBytes() {
    return format().getBytes(StandardCharsets.US_ASCII);
  }

  /**
   * Parses a header line; the trailing newline is optional.
   *
   * @param line candidate header line; must not be {@code null}
   * @return parsed header
   * @throws IllegalArgumentException if the line is not a valid chunk header
   */
  public static ChunkHeader parse(String line) {
    Matcher matcher = LINE.matcher(line);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Malformed chunk header: " + line.strip());
    }
    try {
      return new ChunkHeader(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Chunk length out of range: " + line.strip(), ex);
    }
  }
}
