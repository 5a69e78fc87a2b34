package ca.gc.cra.chunkio.infrastructure.protocol.chunked;

import ca.gc.cra.chunkio.application.port.MetricsPort;
import ca.gc.cra.chunkio.application.port.RecordWriter;
import ca.gc.cra.chunkio.config.WriterConfig;
import ca.gc.cra.chunkio.domain.chunk.ChunkHeader;
import ca.gc.cra.chunkio.domain.chunk.FlushMode;
import ca.gc.cra.chunkio.domain.inspector.Inspector;
import ca.gc.cra.chunkio.domain.inspector.SearchMetric;
import ca.gc.cra.chunkio.domain.inspector.Severity;
import ca.gc.cra.chunkio.infrastructure.codec.MetadataCodec;
import ca.gc.cra.chunkio.logging.Logs;
import ca.gc.cra.chunkio.validation.Numbers;
import ca.gc.cra.chunkio.validation.Strings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Record writer that emits results to the host as {@code chunked 1.0} chunks.
 *
 * <p>Records are buffered until {@link WriterConfig#maxResultRows()} of them are pending, at which point a
 * {@link FlushMode#CONTINUE} chunk is written before {@link #writeRecord(Map)} returns. Field names accumulate
 * additively in first-seen order and are never dropped. Inspector messages and metrics travel with the next
 * chunk and are cleared once it has been written.</p>
 *
 * <p>Each chunk is assembled in memory and handed to the destination in a single write, so a failing stream
 * never observes a partial chunk; buffers stay intact when the write fails. Once the write returns the chunk
 * counts as sent, even if flushing the destination then fails. The destination is never closed by the writer.</p>
 *
 * <p>Not thread-safe; one instance serves one command invocation.</p>
 *
 * @since 0.1.0
 */
public final class ChunkedRecordWriter implements RecordWriter {
  private static final Logger log = LoggerFactory.getLogger(ChunkedRecordWriter.class);
  private static final int LOG_TEXT_LIMIT = 256;

  private final OutputStream out;
  private final int maxResultRows;
  private final MetricsPort metrics;
  private final String metricsPrefix;
  private final MetadataCodec codec;
  private final RowBuffer rows;
  private final Inspector inspector = new Inspector();
  private final List<String> fieldNames = new ArrayList<>();
  private final Set<String> knownFields = new HashSet<>();

  private long totalRecordCount;
  private int chunkCount;
  private boolean finished;

  /**
   * Creates a writer with default settings apart from the flush threshold.
   *
   * @param out destination stream; owned by the caller
   * @param maxResultRows pending-record count that triggers an implicit flush; must be positive
   */
  public ChunkedRecordWriter(OutputStream out, int maxResultRows) {
    this(out, WriterConfig.defaults().withMaxResultRows(maxResultRows), MetricsPort.NO_OP);
  }

  /**
   * Creates a writer from configuration.
   *
   * @param out destination stream; owned by the caller
   * @param config writer configuration
   * @param metrics operational metrics sink
   */
  public ChunkedRecordWriter(OutputStream out, WriterConfig config, MetricsPort metrics) {
    this(out, config, metrics, new MetadataCodec());
  }

  ChunkedRecordWriter(OutputStream out, WriterConfig config, MetricsPort metrics, MetadataCodec codec) {
    this.out = Objects.requireNonNull(out, "out");
    Objects.requireNonNull(config, "config");
    this.maxResultRows = config.maxResultRows();
    this.metricsPrefix = config.metricsPrefix();
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.rows = new RowBuffer(codec);
  }

  @Override
  public void writeRecord(Map<String, ?> record) throws IOException {
    Objects.requireNonNull(record, "record");
    ensureOpen();
    List<String> added = new ArrayList<>();
    for (String name : record.keySet()) {
      if (name == null) {
        throw new IllegalArgumentException("record field names must not be null");
      }
      if (!knownFields.contains(name)) {
        added.add(name);
      }
    }
    List<String> layout = fieldNames;
    if (!added.isEmpty()) {
      layout = new ArrayList<>(fieldNames);
      layout.addAll(added);
    }
    // Field names are committed only once the row has serialized cleanly.
    rows.append(layout, record);
    fieldNames.addAll(added);
    knownFields.addAll(added);
    if (rows.size() >= maxResultRows) {
      flush(FlushMode.CONTINUE);
    }
  }

  @Override
  public void writeMessage(Severity severity, String format, Object... args) {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(format, "format");
    String text = MessageFormatter.basicArrayFormat(format, args);
    inspector.addMessage(severity, text);
    log.debug("Inspector message queued severity={} text={}", severity.wireName(),
        Logs.truncate(text, LOG_TEXT_LIMIT));
  }

  /**
   * Adds a formatted message using the severity's wire name.
   *
   * @param severity severity name such as {@code "warn"}
   * @param format message pattern using {@code {}} placeholders
   * @param args placeholder arguments
   * @throws IllegalArgumentException if {@code severity} is not a known severity
   */
  public void writeMessage(String severity, String format, Object... args) {
    writeMessage(Severity.fromWireName(severity), format, args);
  }

  @Override
  public void writeMetric(String name, SearchMetric metric) {
    String metricName = Strings.requireName("metric name", name);
    Objects.requireNonNull(metric, "metric");
    Numbers.requireNonNegative("invocationCount", metric.invocationCount());
    Numbers.requireNonNegative("inputCount", metric.inputCount());
    Numbers.requireNonNegative("outputCount", metric.outputCount());
    inspector.putMetric(metricName, metric);
  }

  @Override
  public void flush(FlushMode mode) throws IOException {
    Objects.requireNonNull(mode, "mode");
    ensureOpen();
    long started = System.nanoTime();

    byte[] metadata = codec.encodeToBytes(metadata(mode));
    byte[] body = rows.render(fieldNames);
    byte[] header = new ChunkHeader(metadata.length, body.length).toBytes();
    ByteArrayOutputStream chunk = new ByteArrayOutputStream(header.length + metadata.length + body.length);
    chunk.writeBytes(header);
    chunk.writeBytes(metadata);
    chunk.writeBytes(body);

    out.write(chunk.toByteArray());

    // Written: commit before flushing the destination.
    int committed = rows.size();
    totalRecordCount += committed;
    chunkCount++;
    rows.clear();
    inspector.clear();
    if (mode == FlushMode.FINISHED) {
      finished = true;
    }

    metrics.increment(metricsPrefix + ".chunks.flushed");
    metrics.observe(metricsPrefix + ".records.committed", committed);
    metrics.observe(metricsPrefix + ".chunk.bytes", chunk.size());
    metrics.observe(metricsPrefix + ".flush.latencyNanos", System.nanoTime() - started);
    out.flush();
    log.debug("Flushed chunk {} mode={} records={} metadataBytes={} bodyBytes={}",
        chunkCount, mode, committed, metadata.length, body.length);
    if (finished) {
      log.info("Record writer finished after {} chunks and {} records", chunkCount, totalRecordCount);
    }
  }

  private Map<String, Object> metadata(FlushMode mode) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    if (!fieldNames.isEmpty()) {
      metadata.put("fieldnames", fieldNames);
    }
    metadata.put("inspector", inspector.toMetadata());
    metadata.put("finished", mode.finished());
    metadata.put("partial", mode.partial());
    return metadata;
  }

  private void ensureOpen() {
    if (finished) {
      throw new IllegalStateException("Record writer has finished; no further records or chunks may be written");
    }
  }

  @Override
  public int pendingRecordCount() {
    return rows.size();
  }

  @Override
  public long committedRecordCount() {
    return totalRecordCount;
  }

  /**
   * Returns the number of chunks written so far.
   *
   * @return cumulative chunk count
   */
  public int chunkCount() {
    return chunkCount;
  }

  /**
   * Returns the field names seen so far, in first-seen order.
   *
   * @return unmodifiable snapshot of the field list
   */
  public List<String> fieldNames() {
    return List.copyOf(fieldNames);
  }

  /**
   * Returns the inspector object that the next chunk would carry.
   *
   * @return unmodifiable snapshot, e.g. {@code {messages=[...], metric.name=[...]}}
   */
  public Map<String, Object> inspector() {
    return Collections.unmodifiableMap(inspector.toMetadata());
  }

  /**
   * Indicates whether a {@link FlushMode#FINISHED} chunk has been written.
   *
   * @return {@code true} once the session has ended
   */
  public boolean isFinished() {
    return finished;
  }
}
