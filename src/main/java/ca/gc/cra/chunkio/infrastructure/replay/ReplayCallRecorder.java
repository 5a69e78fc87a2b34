package ca.gc.cra.chunkio.infrastructure.replay;

import ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec;
import ca.gc.cra.chunkio.infrastructure.codec.MetadataDecodeException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Base64;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Playback mode: serves recorded results in order and verifies the replayed output on {@link #stop()}.
 *
 * <p>Replayed values come back as decoded by {@link MetadataCodec}, so integers are {@link Long}.</p>
 *
 * @since 0.1.0
 */
public final class ReplayCallRecorder implements CallRecorder {
  private static final Logger log = LoggerFactory.getLogger(ReplayCallRecorder.class);

  private final Path path;
  private final byte[] expected;
  private final Deque<Map<String, Deque<Object>>> parts = new ArrayDeque<>();
  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private Map<String, Deque<Object>> currentPart;

  ReplayCallRecorder(Path path, MetadataCodec codec) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    Map<String, Object> recording;
    try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
      recording = codec.decodeObject(in.readAllBytes());
    }
    if (!(recording.get("inputs") instanceof List<?> inputs)
        || !(recording.get("results") instanceof String results)) {
      throw new MetadataDecodeException("Call recording " + path + " lacks inputs or results");
    }
    for (Object part : inputs) {
      if (!(part instanceof Map<?, ?> calls)) {
        throw new MetadataDecodeException("Call recording " + path + " has a malformed part");
      }
      Map<String, Deque<Object>> queues = new LinkedHashMap<>();
      calls.forEach((site, values) -> queues.put(String.valueOf(site), new ArrayDeque<>(asList(values))));
      parts.add(queues);
    }
    this.expected = Base64.getDecoder().decode(results);
    nextPart();
    log.debug("Loaded call recording {} ({} parts)", path, parts.size() + 1);
  }

  private static List<?> asList(Object values) {
    if (values instanceof List<?> list) {
      return list;
    }
    throw new MetadataDecodeException("Call results must be a list");
  }

  @Override
  public Object get(String callSite, Supplier<?> supplier) {
    Deque<Object> results = currentPart.get(callSite);
    if (results == null || results.isEmpty()) {
      throw new IllegalStateException("No recorded result left for " + callSite + " in " + path);
    }
    return results.pollFirst();
  }

  @Override
  public void nextPart() {
    if (parts.isEmpty()) {
      throw new IllegalStateException("No recorded part left in " + path);
    }
    currentPart = parts.pollFirst();
  }

  @Override
  public OutputStream output() {
    return output;
  }

  /**
   * Compares the replayed output with the recorded output.
   *
   * @throws RecordingMismatchException if the bytes differ
   */
  @Override
  public void stop() {
    byte[] actual = output.toByteArray();
    int mismatch = Arrays.mismatch(expected, actual);
    if (mismatch >= 0) {
      log.warn("Replay of {} diverged at byte {}", path, mismatch);
      throw new RecordingMismatchException(expected.length, actual.length, mismatch);
    }
    log.debug("Replay of {} matched {} bytes", path, actual.length);
  }
}
