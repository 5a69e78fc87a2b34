/**
 * <strong>Purpose:</strong> Tee recorders that mirror stream traffic into memory and gzip files for later replay.
 * <p><strong>Concurrency:</strong> Streams are not thread-safe; each is owned by one reader or writer.
 * <p><strong>Observability:</strong> Emits {@code recorder.bytes.captured} and logs file lifecycle at DEBUG.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chunkio.infrastructure.recording;
