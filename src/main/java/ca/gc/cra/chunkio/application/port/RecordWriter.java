package ca.gc.cra.chunkio.application.port;

import ca.gc.cra.chunkio.domain.chunk.FlushMode;
import ca.gc.cra.chunkio.domain.inspector.SearchMetric;
import ca.gc.cra.chunkio.domain.inspector.Severity;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Output port through which a command hands result records to the host.
 * <p><strong>Role:</strong> Implemented by {@code ChunkedRecordWriter}; callers never see the wire framing.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Buffer records and emit them in chunks of bounded row count.</li>
 *   <li>Carry inspector messages and metrics with the next chunk.</li>
 *   <li>Honour the flush protocol: continue, partial, finished.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are single-threaded; one writer per command invocation.</p>
 *
 * @since 0.1.0
 */
public interface RecordWriter {
  /**
   * Buffers one record, flushing a chunk when the row threshold is reached.
   *
   * @param record ordered field-to-value mapping; must not be {@code null}
   * @throws IOException if an implicit flush fails to write to the destination
   * @throws IllegalStateException if the writer has already finished
   */
  void writeRecord(Map<String, ?> record) throws IOException;

  /**
   * Buffers every record of {@code records} in iteration order.
   *
   * @param records records to write; must not be {@code null}
   * @throws IOException if an implicit flush fails
   */
  default void writeRecords(Iterable<? extends Map<String, ?>> records) throws IOException {
    Objects.requireNonNull(records, "records");
    for (Map<String, ?> record : records) {
      writeRecord(record);
    }
  }

  /**
   * Adds a formatted message to the inspector of the next chunk.
   *
   * @param severity message severity; must not be {@code null}
   * @param format message pattern using {@code {}} placeholders
   * @param args placeholder arguments
   */
  void writeMessage(Severity severity, String format, Object... args);

  /**
   * Stores or replaces a named metric in the inspector of the next chunk.
   *
   * @param name metric name; must not be blank
   * @param metric metric value; must not be {@code null}
   */
  void writeMetric(String name, SearchMetric metric);

  /**
   * Emits the buffered records and inspector state as one chunk.
   *
   * @param mode flush mode; must not be {@code null}
   * @throws IOException if the destination rejects the write
   * @throws IllegalStateException if the writer has already finished
   */
  void flush(FlushMode mode) throws IOException;

  /**
   * Flushes using raw host flags; see {@link FlushMode#of(Object, Object)}.
   *
   * @param finished {@code finished} flag; {@code null} when absent
   * @param partial {@code partial} flag; {@code null} when absent
   * @throws IOException if the destination rejects the write
   * @throws IllegalArgumentException if a flag is not a boolean or both flags are {@code true}
   */
  default void flush(Object finished, Object partial) throws IOException {
    flush(FlushMode.of(finished, partial));
  }

  /**
   * Returns the number of records buffered since the last flush.
   *
   * @return pending record count
   */
  int pendingRecordCount();

  /**
   * Returns the number of records emitted in completed chunks.
   *
   * @return cumulative committed record count
   */
  long committedRecordCount();
}
