package ca.gc.cra.chunkio.infrastructure.replay;

import java.io.IOException;
import java.io.OutputStream;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Records or replays the results of named calls so a writer scenario can be re-run
 * byte-for-byte.
 * <p><strong>Role:</strong> Test harness seam; a scenario routes each nondeterministic call through
 * {@link #get(String, Supplier)} and writes its output to {@link #output()}.</p>
 * <p><strong>Modes:</strong> {@link UninitializedCallRecorder} rejects every operation,
 * {@link LiveCallRecorder} captures results and {@link ReplayCallRecorder} serves them back.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 * @see CallRecorders
 */
public sealed interface CallRecorder
    permits UninitializedCallRecorder, LiveCallRecorder, ReplayCallRecorder {

  /**
   * Returns the result for the next call made at {@code callSite}.
   *
   * @param callSite stable call site name
   * @param supplier produces the live value; ignored during replay
   * @return live or recorded result
   */
  Object get(String callSite, Supplier<?> supplier);

  /**
   * Starts the next part of the recording.
   */
  void nextPart();

  /**
   * Returns the stream the scenario writes its output to.
   *
   * @return output stream owned by this recorder
   */
  OutputStream output();

  /**
   * Ends the session: live mode persists the recording, replay mode verifies the output.
   *
   * @throws IOException if the recording cannot be written
   */
  void stop() throws IOException;

  /**
   * Returns the recorder that has not been given a mode yet.
   *
   * @return shared uninitialized recorder
   */
  static CallRecorder uninitialized() {
    return UninitializedCallRecorder.INSTANCE;
  }
}
