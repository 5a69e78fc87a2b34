package ca.gc.cra.chunkio.domain.chunk;

import java.util.Map;

/**
 * <strong>What:</strong> The three ways a chunk can be flushed to the host.
 * <p><strong>Role:</strong> Replaces the legacy pair of {@code finished}/{@code partial} flags so that "at most one
 * of them set" holds by construction.</p>
 * <ul>
 *   <li>{@link #CONTINUE}: regular chunk, more results follow.</li>
 *   <li>{@link #PARTIAL}: intermediate result set; the session stays open.</li>
 *   <li>{@link #FINISHED}: last chunk of the session.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum FlushMode {
  CONTINUE,
  PARTIAL,
  FINISHED;

  /**
   * Returns the value of the {@code finished} flag written into chunk metadata.
   *
   * @return {@code true} only for {@link #FINISHED}
   */
  public boolean finished() {
    return this == FINISHED;
  }

  /**
   * Returns the value of the {@code partial} flag written into chunk metadata.
   *
   * @return {@code true} only for {@link #PARTIAL}
   */
  public boolean partial() {
    return this == PARTIAL;
  }

  /**
   * Converts raw host flags into a flush mode.
   *
   * <p>{@code null} means the flag is absent and counts as {@code false}. Any other non-{@link Boolean}
   * value, or both flags set to {@code true}, is a contract violation.</p>
   *
   * @param finished raw {@code finished} flag; may be {@code null}
   * @param partial raw {@code partial} flag; may be {@code null}
   * @return matching flush mode
   * @throws IllegalArgumentException if a flag is not a boolean or both flags are {@code true}
   */
  public static FlushMode of(Object finished, Object partial) {
    boolean isFinished = requireFlag("finished", finished);
    boolean isPartial = requireFlag("partial", partial);
    if (isFinished && isPartial) {
      throw new IllegalArgumentException("finished and partial are mutually exclusive");
    }
    if (isFinished) {
      return FINISHED;
    }
    return isPartial ? PARTIAL : CONTINUE;
  }

  /**
   * Reads the {@code finished}/{@code partial} entries of decoded chunk metadata.
   *
   * @param metadata decoded metadata object; must not be {@code null}
   * @return flush mode described by the metadata
   * @throws IllegalArgumentException if the flags are malformed
   */
  public static FlushMode fromMetadata(Map<String, ?> metadata) {
    return of(metadata.get("finished"), metadata.get("partial"));
  }

  private static boolean requireFlag(String name, Object value) {
    if (value == null) {
      return false;
    }
    if (!(value instanceof Boolean flag)) {
      throw new IllegalArgumentException(
          name + " must be a boolean (was " + value.getClass().getSimpleName() + ": " + value + ")");
    }
    return flag;
  }
}
