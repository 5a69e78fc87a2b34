package ca.gc.cra.chunkio.infrastructure.replay;

/**
 * Thrown when a {@link CallRecorder} is used before a record or playback mode was selected.
 *
 * @since 0.1.0
 */
public final class RecorderNotConfiguredException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public RecorderNotConfiguredException(String message) {
    super(message);
  }
}
