package ca.gc.cra.chunkio.infrastructure.protocol.chunked;

import ca.gc.cra.chunkio.domain.chunk.Chunk;
import ca.gc.cra.chunkio.domain.chunk.ChunkHeader;
import ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code chunked 1.0} chunks from a byte stream.
 * <p>Not thread-safe; the reader never closes the wrapped stream.</p>
 *
 * @since 0.1.0
 */
public final class ChunkReader {
  private static final Logger log = LoggerFactory.getLogger(ChunkReader.class);
  private static final int MAX_HEADER_BYTES = 64;

  private final InputStream in;
  private final MetadataCodec codec;
  private long chunksRead;

  /**
   * Creates a reader over {@code in}.
   *
   * @param in source stream; owned by the caller
   */
  public ChunkReader(InputStream in) {
    this(in, new MetadataCodec());
  }

  /**
   * Creates a reader over {@code in} using the supplied codec.
   *
   * @param in source stream; owned by the caller
   * @param codec metadata codec
   */
  public ChunkReader(InputStream in, MetadataCodec codec) {
    this.in = Objects.requireNonNull(in, "in");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Reads the next chunk.
   *
   * @return next chunk, or empty at a clean end of stream
   * @throws ChunkFormatException if the header is malformed or a block is truncated
   * @throws ca.gc.cra.chunkio.infrastructure.codec.MetadataDecodeException if the metadata is not valid JSON
   * @throws IOException if reading the stream fails
   */
  public Optional<Chunk> next() throws IOException {
    String line = readHeaderLine();
    if (line == null) {
      return Optional.empty();
    }
    ChunkHeader header;
    try {
      header = ChunkHeader.parse(line);
    } catch (IllegalArgumentException ex) {
      throw new ChunkFormatException(ex.getMessage(), ex);
    }
    byte[] metadataBytes = readBlock("metadata", header.metadataLength());
    byte[] body = readBlock("body", header.bodyLength());
    Map<String, Object> metadata = codec.decodeObject(metadataBytes);
    chunksRead++;
    log.debug("Read chunk {} metadataBytes={} bodyBytes={}", chunksRead, metadataBytes.length, body.length);
    return Optional.of(new Chunk(metadata, body));
  }

  /**
   * Returns the number of chunks read so far.
   *
   * @return chunk count
   */
  public long chunksRead() {
    return chunksRead;
  }

  private String readHeaderLine() throws IOException {
    ByteArrayOutputStream line = new ByteArrayOutputStream(MAX_HEADER_BYTES);
    while (true) {
      int b = in.read();
      if (b < 0) {
        if (line.size() == 0) {
          return null;
        }
        throw new ChunkFormatException("Stream ended inside a chunk header after " + line.size() + " bytes");
      }
      line.write(b);
      if (b == '\n') {
        return line.toString(StandardCharsets.US_ASCII);
      }
      if (line.size() >= MAX_HEADER_BYTES) {
        throw new ChunkFormatException("Chunk header exceeds " + MAX_HEADER_BYTES + " bytes");
      }
    }
  }

  private byte[] readBlock(String name, int length) throws IOException {
    byte[] block = in.readNBytes(length);
    if (block.length != length) {
      throw new ChunkFormatException(
          "Truncated " + name + " block: expected " + length + " bytes but read " + block.length);
    }
    return block;
  }
}
