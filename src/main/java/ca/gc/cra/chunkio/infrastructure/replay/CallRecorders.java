package ca.gc.cra.chunkio.infrastructure.replay;

import ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Selects a {@link CallRecorder} mode.
 *
 * @since 0.1.0
 */
public final class CallRecorders {
  private static final MetadataCodec CODEC = new MetadataCodec();

  private CallRecorders() {
    // Utility
  }

  /**
   * Starts a live session that will be saved to {@code path} on {@link CallRecorder#stop()}.
   *
   * @param path recording destination
   * @return live recorder
   */
  public static LiveCallRecorder record(Path path) {
    return new LiveCallRecorder(path, CODEC);
  }

  /**
   * Loads a recording for playback.
   *
   * @param path recording written by a live session
   * @return replay recorder positioned on the first part
   * @throws IOException if the recording cannot be read
   */
  public static ReplayCallRecorder playback(Path path) throws IOException {
    return new ReplayCallRecorder(path, CODEC);
  }
}
