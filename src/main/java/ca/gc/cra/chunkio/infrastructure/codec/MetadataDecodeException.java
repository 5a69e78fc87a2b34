package ca.gc.cra.chunkio.infrastructure.codec;

/**
 * Raised when chunk metadata cannot be decoded. Fatal for the chunk being processed.
 *
 * @since 0.1.0
 */
public final class MetadataDecodeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message description of the decoding failure
   */
  public MetadataDecodeException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping the parser failure.
   *
   * @param message description of the decoding failure
   * @param cause underlying parser exception
   */
  public MetadataDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
