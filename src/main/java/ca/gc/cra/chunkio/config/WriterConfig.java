package ca.gc.cra.chunkio.config;

import ca.gc.cra.chunkio.validation.Numbers;
import ca.gc.cra.chunkio.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable settings for a record writer and its optional traffic recording.
 * <p><strong>Role:</strong> Configuration record consumed by {@code ChunkedRecordWriter} and {@code Recordings}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param maxResultRows row count that triggers an implicit flush; between 1 and {@value #MAX_RESULT_ROWS_LIMIT}
 * @param recordingEnabled whether writer and reader streams are wrapped by tee recorders
 * @param recordingDirectory directory receiving recording files
 * @param metricsPrefix dotted prefix for operational metrics emitted by the writer
 * @since 0.1.0
 */
public record WriterConfig(
    int maxResultRows,
    boolean recordingEnabled,
    Path recordingDirectory,
    String metricsPrefix) {

  /** Default implicit flush threshold. */
  public static final int DEFAULT_MAX_RESULT_ROWS = 50_000;

  /** Largest accepted implicit flush threshold. */
  public static final int MAX_RESULT_ROWS_LIMIT = 10_000_000;

  /** Default operational metrics prefix. */
  public static final String DEFAULT_METRICS_PREFIX = "chunkio.writer";

  /** Setting key for {@link #maxResultRows()}. */
  public static final String KEY_MAX_RESULT_ROWS = "maxResultRows";
  /** Setting key for {@link #recordingEnabled()}. */
  public static final String KEY_RECORDING_ENABLED = "recording.enabled";
  /** Setting key for {@link #recordingDirectory()}. */
  public static final String KEY_RECORDING_DIRECTORY = "recording.directory";
  /** Setting key for {@link #metricsPrefix()}. */
  public static final String KEY_METRICS_PREFIX = "metrics.prefix";

  /** Every setting key understood by {@link #fromMap(Map)}. */
  public static final Set<String> KEYS = Set.of(
      KEY_MAX_RESULT_ROWS, KEY_RECORDING_ENABLED, KEY_RECORDING_DIRECTORY, KEY_METRICS_PREFIX);

  /**
   * Validates the configuration values.
   *
   * @throws IllegalArgumentException if the threshold is out of range or the prefix is not a dotted identifier
   * @throws NullPointerException if the recording directory or prefix is {@code null}
   */
  public WriterConfig {
    Numbers.requireRange("maxResultRows", maxResultRows, 1, MAX_RESULT_ROWS_LIMIT);
    Objects.requireNonNull(recordingDirectory, "recordingDirectory");
    metricsPrefix = Strings.requireDottedIdentifier("metricsPrefix", metricsPrefix);
  }

  /**
   * Provides default values used when no external configuration is supplied.
   *
   * @return default configuration
   */
  public static WriterConfig defaults() {
    return new WriterConfig(
        DEFAULT_MAX_RESULT_ROWS,
        false,
        Path.of(System.getProperty("java.io.tmpdir")),
        DEFAULT_METRICS_PREFIX);
  }

  /**
   * Returns a copy with a different implicit flush threshold.
   *
   * @param rows new threshold
   * @return updated configuration
   */
  public WriterConfig withMaxResultRows(int rows) {
    return new WriterConfig(rows, recordingEnabled, recordingDirectory, metricsPrefix);
  }

  /**
   * Builds a configuration from flat key/value pairs, falling back to {@link #defaults()} per key.
   *
   * <p>Recognized keys: {@code maxResultRows}, {@code recording.enabled}, {@code recording.directory},
   * {@code metrics.prefix}.</p>
   *
   * @param values flat configuration map; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a value cannot be parsed or fails validation
   */
  public static WriterConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    WriterConfig defaults = defaults();
    int rows = parseInt(KEY_MAX_RESULT_ROWS, values.get(KEY_MAX_RESULT_ROWS), defaults.maxResultRows());
    boolean recording = parseBoolean(KEY_RECORDING_ENABLED, values.get(KEY_RECORDING_ENABLED),
        defaults.recordingEnabled());
    String directory = values.get(KEY_RECORDING_DIRECTORY);
    Path recordingDir = directory == null || directory.isBlank()
        ? defaults.recordingDirectory()
        : Path.of(directory.trim());
    String prefix = values.getOrDefault(KEY_METRICS_PREFIX, defaults.metricsPrefix());
    return new WriterConfig(rows, recording, recordingDir, prefix);
  }

  private static int parseInt(String key, String raw, int fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String key, String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was " + raw + ")");
    };
  }
}
