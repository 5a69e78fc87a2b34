package ca.gc.cra.chunkio.infrastructure.recording;

import ca.gc.cra.chunkio.application.port.MetricsPort;
import ca.gc.cra.chunkio.config.WriterConfig;
import ca.gc.cra.chunkio.validation.Strings;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Factory and helpers for tee recordings of writer and reader traffic.
 * <p><strong>Role:</strong> Wraps streams according to {@link WriterConfig#recordingEnabled()} and reads finished
 * recordings back.</p>
 * <p><strong>Thread-safety:</strong> Static helpers are thread-safe; the returned streams are not.</p>
 *
 * @since 0.1.0
 */
public final class Recordings {
  private static final Logger log = LoggerFactory.getLogger(Recordings.class);
  private static final DateTimeFormatter TS =
      DateTimeFormatter.ofPattern("uuuuMMdd-HHmmss").withZone(ZoneId.systemDefault());
  private static final AtomicInteger SEQUENCE = new AtomicInteger();

  private Recordings() {
    // Utility
  }

  /**
   * Reads a gzip recording back into memory.
   *
   * @param path recording file
   * @return decompressed bytes
   * @throws IOException if the file is missing or not valid gzip
   */
  public static byte[] decompress(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
      return in.readAllBytes();
    }
  }

  /**
   * Allocates a fresh recording path {@code <baseName>-<timestamp>-<seq>.gz} inside {@code directory}.
   *
   * @param directory target directory; created when missing
   * @param baseName file name prefix
   * @return path that did not exist when allocated
   * @throws IOException if the directory cannot be created
   */
  public static Path createRecordingFile(Path directory, String baseName) throws IOException {
    Objects.requireNonNull(directory, "directory");
    String base = Strings.requireDottedIdentifier("baseName", baseName);
    Files.createDirectories(directory);
    String timestamp = TS.format(Instant.now());
    Path candidate;
    do {
      candidate = directory.resolve(recordingFileName(base, timestamp, SEQUENCE.getAndIncrement()));
    } while (Files.exists(candidate));
    return candidate;
  }

  static String recordingFileName(String baseName, String timestamp, int sequence) {
    // Sequence wraps past Integer.MAX_VALUE; keep the suffix within 0000-9999.
    return String.format("%s-%s-%04d.gz", baseName, timestamp, Math.floorMod(sequence, 10_000));
  }

  /**
   * Wraps {@code in} with a {@link RecordingInputStream} when recording is enabled.
   *
   * @param in stream to wrap
   * @param baseName recording file name prefix
   * @param config recording settings
   * @param metrics operational metrics sink
   * @return recording stream, or {@code in} itself when recording is disabled
   * @throws IOException if the recording file cannot be created
   */
  public static InputStream wrapInput(InputStream in, String baseName, WriterConfig config, MetricsPort metrics)
      throws IOException {
    Objects.requireNonNull(in, "in");
    if (!config.recordingEnabled()) {
      return in;
    }
    Path path = createRecordingFile(config.recordingDirectory(), baseName);
    log.info("Recording input to {}", path);
    return new RecordingInputStream(in, path, metrics);
  }

  /**
   * Wraps {@code out} with a {@link RecordingOutputStream} when recording is enabled.
   *
   * @param out stream to wrap
   * @param baseName recording file name prefix
   * @param config recording settings
   * @param metrics operational metrics sink
   * @return recording stream, or {@code out} itself when recording is disabled
   * @throws IOException if the recording file cannot be created
   */
  public static OutputStream wrapOutput(OutputStream out, String baseName, WriterConfig config, MetricsPort metrics)
      throws IOException {
    Objects.requireNonNull(out, "out");
    if (!config.recordingEnabled()) {
      return out;
    }
    Path path = createRecordingFile(config.recordingDirectory(), baseName);
    log.info("Recording output to {}", path);
    return new RecordingOutputStream(out, path, metrics);
  }

  static void closeBoth(RecordingTap tap, Closeable wrapped) throws IOException {
    IOException failure = null;
    try {
      tap.close();
    } catch (IOException ex) {
      failure = ex;
    } finally {
      try {
        wrapped.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
