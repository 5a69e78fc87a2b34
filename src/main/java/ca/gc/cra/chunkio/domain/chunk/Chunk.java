package ca.gc.cra.chunkio.domain.chunk;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One decoded unit of the chunked protocol: the metadata object and the raw body.
 * <p><strong>Role:</strong> Domain value produced by chunk readers and inspected by hosts and tests.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the metadata map and body are copied on construction.</p>
 *
 * @param metadata decoded metadata object, key order preserved
 * @param body body bytes exactly as framed on the wire
 * @since 0.1.0
 */
public record Chunk(Map<String, Object> metadata, byte[] body) {

  /**
   * Copies the metadata and body so the chunk cannot be mutated by the producer.
   */
  public Chunk {
    Objects.requireNonNull(metadata, "metadata");
    metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    body = body != null ? body.clone() : new byte[0];
  }

  /**
   * Returns a copy of the body bytes.
   *
   * @return body bytes
   */
  @Override
  public byte[] body() {
    return body.clone();
  }

  /**
   * Decodes the body as UTF-8 text.
   *
   * @return body text; empty when the chunk carries no rows
   */
  public String bodyText() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /**
   * Returns the field names announced by the chunk.
   *
   * @return field names in wire order; empty when the metadata omits them
   */
  public List<String> fieldNames() {
    Object value = metadata.get("fieldnames");
    if (!(value instanceof List<?> names)) {
      return List.of();
    }
    List<String> result = new ArrayList<>(names.size());
    for (Object name : names) {
      result.add(String.valueOf(name));
    }
    return List.copyOf(result);
  }

  /**
   * Returns the inspector object carried by the chunk.
   *
   * @return inspector entries; empty when absent
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> inspector() {
    Object value = metadata.get("inspector");
    if (value instanceof Map<?, ?> map) {
      return Collections.unmodifiableMap((Map<String, Object>) map);
    }
    return Map.of();
  }

  /**
   * Derives the flush mode from the {@code finished}/{@code partial} flags.
   *
   * @return flush mode of this chunk
   * @throws IllegalArgumentException if the flags are malformed
   */
  public FlushMode flushMode() {
    return FlushMode.fromMetadata(metadata);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Chunk that)) {
      return false;
    }
    return metadata.equals(that.metadata) && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    return 31 * metadata.hashCode() + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "Chunk[metadata=" + metadata + ", bodyLength=" + body.length + "]";
  }
}
