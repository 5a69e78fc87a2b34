package ca.gc.cra.chunkio.infrastructure.protocol.chunked;

import java.io.IOException;

/**
 * Signals a chunk stream that violates the {@code chunked 1.0} framing.
 *
 * @since 0.1.0
 */
public final class ChunkFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  public ChunkFormatException(String message) {
    super(message);
  }

  public ChunkFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
