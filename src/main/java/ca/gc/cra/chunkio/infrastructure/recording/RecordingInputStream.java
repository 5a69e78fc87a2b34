package ca.gc.cra.chunkio.infrastructure.recording;

import ca.gc.cra.chunkio.application.port.MetricsPort;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Input stream that returns the wrapped stream's bytes unchanged while recording every byte it hands out.
 *
 * <p>Each read appends exactly the bytes returned to the caller, in call order, to an in-memory mirror and to
 * a gzip-compressed recording file. {@link #close()} completes the recording before closing the wrapped
 * stream. Mark/reset is not supported; {@link #skip(long)} reads and records the skipped bytes.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class RecordingInputStream extends FilterInputStream {
  private final RecordingTap tap;

  /**
   * Wraps {@code in}, recording into a new file at {@code recording}.
   *
   * @param in stream to wrap
   * @param recording recording file path; created or truncated
   * @throws IOException if the recording file cannot be opened
   */
  public RecordingInputStream(InputStream in, Path recording) throws IOException {
    this(in, recording, MetricsPort.NO_OP);
  }

  /**
   * Wraps {@code in}, recording into a new file at {@code recording} and reporting captured bytes.
   *
   * @param in stream to wrap
   * @param recording recording file path; created or truncated
   * @param metrics operational metrics sink
   * @throws IOException if the recording file cannot be opened
   */
  public RecordingInputStream(InputStream in, Path recording, MetricsPort metrics) throws IOException {
    super(Objects.requireNonNull(in, "in"));
    this.tap = new RecordingTap(recording, metrics);
  }

  @Override
  public int read() throws IOException {
    int value = in.read();
    if (value >= 0) {
      tap.capture(value);
    }
    return value;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    int count = in.read(b, off, len);
    if (count > 0) {
      tap.capture(b, off, count);
    }
    return count;
  }

  /**
   * Reads one line, including its trailing {@code \n} when present.
   *
   * @return line bytes; the remainder of the stream when no newline follows; empty at end of stream
   * @throws IOException if reading or recording fails
   */
  public byte[] readLine() throws IOException {
    ByteArrayOutputStream line = new ByteArrayOutputStream();
    int value;
    while ((value = in.read()) >= 0) {
      line.write(value);
      if (value == '\n') {
        break;
      }
    }
    byte[] bytes = line.toByteArray();
    tap.capture(bytes, 0, bytes.length);
    return bytes;
  }

  @Override
  public long skip(long n) throws IOException {
    if (n <= 0) {
      return 0;
    }
    byte[] scratch = new byte[(int) Math.min(n, 8192)];
    long skipped = 0;
    while (skipped < n) {
      int count = read(scratch, 0, (int) Math.min(scratch.length, n - skipped));
      if (count < 0) {
        break;
      }
      skipped += count;
    }
    return skipped;
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  @Override
  public synchronized void mark(int readlimit) {
    // Unsupported
  }

  @Override
  public synchronized void reset() throws IOException {
    throw new IOException("mark/reset not supported by recording streams");
  }

  /**
   * Returns every byte read so far.
   *
   * @return copy of the mirror
   */
  public byte[] mirror() {
    return tap.mirror();
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
   * Completes the recording, then closes the wrapped stream.
   *
   * @throws IOException if either close fails; a second failure is attached as suppressed
   */
  @Override
  public void close() throws IOException {
    Recordings.closeBoth(tap, in);
  }
}
