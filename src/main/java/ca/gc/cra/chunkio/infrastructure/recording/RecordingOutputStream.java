package ca.gc.cra.chunkio.infrastructure.recording;

import ca.gc.cra.chunkio.application.port.MetricsPort;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Output stream that forwards writes unchanged to the wrapped stream and records every accepted byte.
 *
 * <p>Bytes are recorded after the wrapped stream accepted them, in call order, into an in-memory mirror and a
 * gzip-compressed recording file. {@link #close()} completes the recording before closing the wrapped stream.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class RecordingOutputStream extends FilterOutputStream {
  private final RecordingTap tap;

  /**
   * Wraps {@code out}, recording into a new file at {@code recording}.
   *
   * @param out stream to wrap
   * @param recording recording file path; created or truncated
   * @throws IOException if the recording file cannot be opened
   */
  public RecordingOutputStream(OutputStream out, Path recording) throws IOException {
    this(out, recording, MetricsPort.NO_OP);
  }

  /**
   * Wraps {@code out}, recording into a new file at {@code recording} and reporting captured bytes.
   *
   * @param out stream to wrap
   * @param recording recording file path; created or truncated
   * @param metrics operational metrics sink
   * @throws IOException if the recording file cannot be opened
   */
  public RecordingOutputStream(OutputStream out, Path recording, MetricsPort metrics) throws IOException {
    super(Objects.requireNonNull(out, "out"));
    this.tap = new RecordingTap(recording, metrics);
  }

  @Override
  public void write(int b) throws IOException {
    out.write(b);
    tap.capture(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    out.write(b, off, len);
    tap.capture(b, off, len);
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }

  /**
   * Returns every byte written so far.
   *
   * @return copy of the mirror
   */
  public byte[] toByteArray() {
    return tap.mirror();
  }

  /**
   * Same as {@link #toByteArray()}.
   *
   * @return copy of the mirror
   */
  public byte[] mirror() {
    return toByteArray();
  }

  /**
   * Returns the recording file path.
   *
   * @return path of the gzip recording
   */
  public Path recordingPath() {
    return tap.path();
  }

  /**
   * Completes the recording, then flushes and closes the wrapped stream.
   *
   * @throws IOException if either close fails; a second failure is attached as suppressed
   */
  @Override
  public void close() throws IOException {
    if (tap.isClosed()) {
      return;
    }
    Recordings.closeBoth(tap, out);
  }
}
