package ca.gc.cra.chunkio.infrastructure.recording;

import ca.gc.cra.chunkio.application.port.MetricsPort;
import ca.gc.cra.chunkio.logging.Logs;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Side channel shared by the recording streams: an in-memory mirror plus a gzip-compressed recording file.
 * <p>Not thread-safe.</p>
 */
final class RecordingTap implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(RecordingTap.class);
  private static final int FILE_BUFFER_BYTES = 64 * 1024;

  private final Path path;
  private final MetricsPort metrics;
  private final ByteArrayOutputStream mirror = new ByteArrayOutputStream();
  private final OutputStream recording;
  private boolean closed;

  RecordingTap(Path path, MetricsPort metrics) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    OutputStream file = Files.newOutputStream(
        path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    try {
      this.recording = new GZIPOutputStream(new BufferedOutputStream(file, FILE_BUFFER_BYTES));
    } catch (IOException | RuntimeException ex) {
      try {
        file.close();
      } catch (IOException closeError) {
        ex.addSuppressed(closeError);
      }
      throw ex;
    }
    log.debug("Opened recording {}", path);
  }

  /**
   * Appends the observed bytes to the mirror and to the compressed recording.
   */
  void capture(byte[] data, int offset, int length) throws IOException {
    if (length <= 0) {
      return;
    }
    if (closed) {
      throw new IOException("Recording " + path + " is closed");
    }
    mirror.write(data, offset, length);
    recording.write(data, offset, length);
    metrics.observe("recorder.bytes.captured", length);
  }

  void capture(int value) throws IOException {
    capture(new byte[] {(byte) value}, 0, 1);
  }

  byte[] mirror() {
    return mirror.toByteArray();
  }

  Path path() {
    return path;
  }

  boolean isClosed() {
    return closed;
  }

  /**
   * Writes the gzip trailer and closes the recording file. Idempotent.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      recording.close();
      log.debug("Closed recording {} ({} captured)", path, Logs.size(mirror.size()));
    } catch (IOException ex) {
      log.warn("Failed to close recording {}", path, ex);
      throw ex;
    }
  }
}
