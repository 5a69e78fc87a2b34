package ca.gc.cra.chunkio.infrastructure.replay;

/**
 * Thrown when replayed output differs from the output captured at record time.
 *
 * @since 0.1.0
 */
public final class RecordingMismatchException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int expectedLength;
  private final int actualLength;
  private final int firstDifference;

  public RecordingMismatchException(int expectedLength, int actualLength, int firstDifference) {
    super("Replayed output differs from recording at byte " + firstDifference
        + " (expected " + expectedLength + " bytes, got " + actualLength + ")");
    this.expectedLength = expectedLength;
    this.actualLength = actualLength;
    this.firstDifference = firstDifference;
  }

  public int expectedLength() {
    return expectedLength;
  }

  public int actualLength() {
    return actualLength;
  }

  /** Offset of the first differing byte. */
  public int firstDifference() {
    return firstDifference;
  }
}
