package ca.gc.cra.chunkio.infrastructure.replay;

import ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec;
import ca.gc.cra.chunkio.logging.Logs;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record mode: invokes each supplier, keeps its result per call site and part, and persists the session on
 * {@link #stop()}.
 *
 * <p>The recording is gzip-compressed JSON {@code {"inputs":[{callSite:[results...]}...],"results":"<base64>"}}
 * where {@code results} holds the bytes written to {@link #output()}. Results must be values the
 * {@link MetadataCodec} can encode.</p>
 *
 * @since 0.1.0
 */
public final class LiveCallRecorder implements CallRecorder {
  private static final Logger log = LoggerFactory.getLogger(LiveCallRecorder.class);

  private final Path path;
  private final MetadataCodec codec;
  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private final List<Map<String, List<Object>>> parts = new ArrayList<>();
  private Map<String, List<Object>> currentPart;

  LiveCallRecorder(Path path, MetadataCodec codec) {
    this.path = Objects.requireNonNull(path, "path");
    this.codec = Objects.requireNonNull(codec, "codec");
    nextPart();
  }

  @Override
  public Object get(String callSite, Supplier<?> supplier) {
    Objects.requireNonNull(callSite, "callSite");
    Object result = supplier.get();
    currentPart.computeIfAbsent(callSite, key -> new ArrayList<>()).add(result);
    return result;
  }

  @Override
  public void nextPart() {
    currentPart = new LinkedHashMap<>();
    parts.add(currentPart);
  }

  @Override
  public OutputStream output() {
    return output;
  }

  /** Number of parts started so far. */
  public int partCount() {
    return parts.size();
  }

  @Override
  public void stop() throws IOException {
    Map<String, Object> recording = new LinkedHashMap<>();
    recording.put("inputs", parts);
    recording.put("results", Base64.getEncoder().encodeToString(output.toByteArray()));
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = new GZIPOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
      codec.encode(recording, out);
    }
    log.info("Saved call recording {} ({} parts, {} output)", path, parts.size(), Logs.size(output.size()));
  }
}
